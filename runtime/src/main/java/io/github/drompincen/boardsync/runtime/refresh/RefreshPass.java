package io.github.drompincen.boardsync.runtime.refresh;

/**
 * One refetch of every actively subscribed list, publishing whatever changed.
 */
@FunctionalInterface
public interface RefreshPass {

    void refreshAll();
}
