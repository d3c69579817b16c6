package io.github.drompincen.boardsync.runtime.watch;

@FunctionalInterface
public interface StoreChangeListener {

    void onStoreChanged();
}
