package io.github.drompincen.boardsync.runtime.source;

import io.github.drompincen.boardsync.protocol.subscription.SubscriptionSpec;
import io.github.drompincen.boardsync.runtime.workspace.WorkspaceConfig;

/**
 * Fetches the current membership and content of a list. Implementations must be
 * safe to call concurrently for different specs.
 */
public interface ItemSource {

    FetchResult fetch(SubscriptionSpec spec, WorkspaceConfig workspace);
}
