package com.spsync.ingest;

@FunctionalInterface
public interface IndexChangeListener {
    void onIndexChanged(long indexVersion);
}
