package io.github.drompincen.boardsync.runtime.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.boardsync.protocol.api.Issue;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionSpec;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionType;
import io.github.drompincen.boardsync.runtime.bd.BdResult;
import io.github.drompincen.boardsync.runtime.bd.BdRunner;
import io.github.drompincen.boardsync.runtime.workspace.WorkspaceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BdItemSourceTest {

    @Mock private BdRunner bd;

    private final ObjectMapper mapper = new ObjectMapper();
    private final WorkspaceConfig ws = new WorkspaceConfig("/work", "/work/.beads/issues.db");
    private BdItemSource source;

    @BeforeEach
    void setUp() {
        source = new BdItemSource(bd, mapper);
    }

    private void bdReturns(List<String> args, String json) throws Exception {
        when(bd.runJson(eq(args), any())).thenReturn(BdResult.of(0, json, "").withJson(mapper.readTree(json)));
    }

    @Test
    void mapsListTypesToCommands() {
        assertThat(BdItemSource.argsFor(SubscriptionType.READY_ISSUES, Map.of()))
                .containsExactly("ready", "--limit", "1000", "--json");
        assertThat(BdItemSource.argsFor(SubscriptionType.IN_PROGRESS_ISSUES, Map.of()))
                .containsExactly("list", "--json", "--status", "in_progress");
        assertThat(BdItemSource.argsFor(SubscriptionType.ISSUE_DETAIL, Map.of("id", "UI-3")))
                .containsExactly("show", "UI-3", "--json");
    }

    @Test
    void normalizesTimestampsAndSkipsEntriesWithoutId() throws Exception {
        bdReturns(List.of("list", "--json"), "[" +
                "{\"id\":\"UI-1\",\"title\":\"a\",\"created_at\":\"2024-01-01T00:00:00Z\",\"updated_at\":\"2024-01-02T00:00:00.000Z\"}," +
                "{\"title\":\"orphan\"}," +
                "{\"id\":\"UI-2\",\"updated_at\":5,\"closed_at\":\"2024-01-03T00:00:00+00:00\"}]");

        FetchResult result = source.fetch(SubscriptionSpec.of("all-issues"), ws);

        assertThat(result.ok()).isTrue();
        assertThat(result.items()).extracting(Issue::id).containsExactly("UI-1", "UI-2");
        Issue first = result.items().get(0);
        assertThat(first.createdAt()).isEqualTo(1704067200000L);
        assertThat(first.updatedAt()).isEqualTo(1704153600000L);
        assertThat(first.closedAt()).isNull();
        assertThat(first.fields()).containsKey(Issue.CLOSED_AT);
        assertThat(result.items().get(1).updatedAt()).isEqualTo(5);
        assertThat(result.items().get(1).closedAt()).isEqualTo(1704240000000L);
    }

    @Test
    void singleObjectBecomesOneItem() throws Exception {
        bdReturns(List.of("show", "UI-9", "--json"), "{\"id\":\"UI-9\",\"title\":\"detail\"}");

        FetchResult result = source.fetch(SubscriptionSpec.of("issue-detail", Map.of("id", "UI-9")), ws);

        assertThat(result.items()).hasSize(1);
        assertThat(result.items().get(0).get("title")).isEqualTo("detail");
    }

    @Test
    void flattensEpicStatusEntries() throws Exception {
        bdReturns(List.of("epic", "status", "--json"),
                "[{\"epic\":{\"id\":\"EP-1\",\"title\":\"Epic\"},\"total_children\":4,\"closed_children\":1,\"eligible_for_close\":false}]");

        FetchResult result = source.fetch(SubscriptionSpec.of("epics"), ws);

        Issue epic = result.items().get(0);
        assertThat(epic.id()).isEqualTo("EP-1");
        assertThat(epic.get("total_children")).isEqualTo(4);
        assertThat(epic.get("closed_children")).isEqualTo(1);
        assertThat(epic.get("eligible_for_close")).isEqualTo(false);
    }

    @Test
    void closedIssuesSinceFiltersOlderItems() throws Exception {
        bdReturns(List.of("list", "--json", "--status", "closed"),
                "[{\"id\":\"A\",\"closed_at\":100},{\"id\":\"B\",\"closed_at\":300},{\"id\":\"C\"}]");

        FetchResult result = source.fetch(SubscriptionSpec.of("closed-issues", Map.of("since", 200L)), ws);

        assertThat(result.items()).extracting(Issue::id).containsExactly("B");
    }

    @Test
    void zeroSinceKeepsEverything() throws Exception {
        bdReturns(List.of("list", "--json", "--status", "closed"), "[{\"id\":\"A\",\"closed_at\":100},{\"id\":\"C\"}]");

        FetchResult result = source.fetch(SubscriptionSpec.of("closed-issues", Map.of("since", 0)), ws);

        assertThat(result.items()).hasSize(2);
    }

    @Test
    void bdFailureBecomesBdError() {
        when(bd.runJson(any(), any())).thenReturn(BdResult.failure(1, "no database"));

        FetchResult result = source.fetch(SubscriptionSpec.of("blocked-issues"), ws);

        assertThat(result.ok()).isFalse();
        assertThat(result.error().code()).isEqualTo("bd_error");
        assertThat(result.error().message()).isEqualTo("no database");
    }

    @Test
    void unknownTypeIsRejectedWithoutRunningBd() {
        FetchResult result = source.fetch(SubscriptionSpec.of("mystery"), ws);

        assertThat(result.ok()).isFalse();
        assertThat(result.error().code()).isEqualTo("bad_request");
        verifyNoInteractions(bd);
    }
}
