package io.github.drompincen.boardsync.runtime.mutation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.boardsync.protocol.ws.MessageType;
import io.github.drompincen.boardsync.runtime.ProtocolException;
import io.github.drompincen.boardsync.runtime.bd.BdResult;
import io.github.drompincen.boardsync.runtime.bd.BdRunner;
import io.github.drompincen.boardsync.runtime.refresh.RefreshScheduler;
import io.github.drompincen.boardsync.runtime.workspace.WorkspaceConfig;
import io.github.drompincen.boardsync.runtime.workspace.WorkspaceContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IssueMutationServiceTest {

    @Mock private BdRunner bd;
    @Mock private WorkspaceContext context;
    @Mock private RefreshScheduler scheduler;

    private final ObjectMapper mapper = new ObjectMapper();
    private final WorkspaceConfig ws = new WorkspaceConfig("/work", "/work/.beads/issues.db");
    private IssueMutationService service;

    @BeforeEach
    void setUp() {
        when(context.current()).thenReturn(ws);
        service = new IssueMutationService(bd, context, scheduler);
    }

    private JsonNode json(String s) throws Exception {
        return mapper.readTree(s);
    }

    private void showReturns(String id, String body) throws Exception {
        when(bd.runJson(eq(List.of("show", id, "--json")), eq(ws)))
                .thenReturn(BdResult.of(0, body, "").withJson(mapper.readTree(body)));
    }

    @Test
    void updateStatusRunsBdShowsIssueAndOpensGate() throws Exception {
        when(bd.run(any(), eq(ws))).thenReturn(BdResult.of(0, "", ""));
        showReturns("UI-1", "{\"id\":\"UI-1\",\"status\":\"closed\"}");

        Object reply = service.apply(MessageType.UPDATE_STATUS, json("{\"id\":\"UI-1\",\"status\":\"closed\"}"));

        verify(bd).run(List.of("update", "UI-1", "--status", "closed"), ws);
        assertThat(((JsonNode) reply).get("status").asText()).isEqualTo("closed");
        verify(scheduler).triggerMutationRefresh();
    }

    @Test
    void invalidStatusIsRejectedBeforeBdRuns() throws Exception {
        assertThatThrownBy(() -> service.apply(MessageType.UPDATE_STATUS, json("{\"id\":\"UI-1\",\"status\":\"done\"}")))
                .isInstanceOf(ProtocolException.class)
                .satisfies(e -> assertThat(((ProtocolException) e).error().code()).isEqualTo("bad_request"));
        verifyNoInteractions(bd, scheduler);
    }

    @Test
    void priorityMustBeWithinRange() throws Exception {
        assertThatThrownBy(() -> service.apply(MessageType.UPDATE_PRIORITY, json("{\"id\":\"UI-1\",\"priority\":7}")))
                .isInstanceOf(ProtocolException.class)
                .hasMessage("payload requires { id: string, priority: 0..4 }");
    }

    @Test
    void editTextMapsFieldToFlag() throws Exception {
        when(bd.run(any(), eq(ws))).thenReturn(BdResult.of(0, "", ""));
        showReturns("UI-2", "{\"id\":\"UI-2\"}");

        service.apply(MessageType.EDIT_TEXT, json("{\"id\":\"UI-2\",\"field\":\"acceptance\",\"value\":\"works\"}"));

        verify(bd).run(List.of("update", "UI-2", "--acceptance-criteria", "works"), ws);
    }

    @Test
    void createIssueAddsOptionalFlags() throws Exception {
        when(bd.run(any(), eq(ws))).thenReturn(BdResult.of(0, "", ""));

        Object reply = service.apply(MessageType.CREATE_ISSUE,
                json("{\"title\":\"New\",\"type\":\"bug\",\"priority\":1,\"description\":\"d\"}"));

        verify(bd).run(List.of("create", "New", "-t", "bug", "-p", "1", "-d", "d"), ws);
        assertThat(reply).isEqualTo(Map.of("created", true));
        verify(scheduler).triggerMutationRefresh();
    }

    @Test
    void createIssueIgnoresUnknownType() throws Exception {
        when(bd.run(any(), eq(ws))).thenReturn(BdResult.of(0, "", ""));

        service.apply(MessageType.CREATE_ISSUE, json("{\"title\":\"New\",\"type\":\"story\"}"));

        verify(bd).run(List.of("create", "New"), ws);
    }

    @Test
    void deleteRepliesWithId() throws Exception {
        when(bd.run(any(), eq(ws))).thenReturn(BdResult.of(0, "", ""));

        Object reply = service.apply(MessageType.DELETE_ISSUE, json("{\"id\":\"UI-5\"}"));

        verify(bd).run(List.of("delete", "UI-5", "--force"), ws);
        assertThat(reply).isEqualTo(Map.of("deleted", true, "id", "UI-5"));
    }

    @Test
    void depAddShowsTheViewedIssue() throws Exception {
        when(bd.run(any(), eq(ws))).thenReturn(BdResult.of(0, "", ""));
        showReturns("UI-9", "{\"id\":\"UI-9\"}");

        service.apply(MessageType.DEP_ADD, json("{\"a\":\"UI-1\",\"b\":\"UI-2\",\"view_id\":\"UI-9\"}"));

        verify(bd).run(List.of("dep", "add", "UI-1", "UI-2"), ws);
        verify(bd).runJson(List.of("show", "UI-9", "--json"), ws);
    }

    @Test
    void labelIsTrimmed() throws Exception {
        when(bd.run(any(), eq(ws))).thenReturn(BdResult.of(0, "", ""));
        showReturns("UI-1", "{\"id\":\"UI-1\"}");

        service.apply(MessageType.LABEL_REMOVE, json("{\"id\":\"UI-1\",\"label\":\"  ui \"}"));

        verify(bd).run(List.of("label", "remove", "UI-1", "ui"), ws);
    }

    @Test
    void bdFailureBecomesBdError() throws Exception {
        when(bd.run(any(), eq(ws))).thenReturn(BdResult.failure(1, "issue not found"));

        assertThatThrownBy(() -> service.apply(MessageType.UPDATE_ASSIGNEE, json("{\"id\":\"UI-1\",\"assignee\":\"ana\"}")))
                .isInstanceOf(ProtocolException.class)
                .satisfies(e -> {
                    ProtocolException pe = (ProtocolException) e;
                    assertThat(pe.error().code()).isEqualTo("bd_error");
                    assertThat(pe.error().message()).isEqualTo("issue not found");
                });
        verify(scheduler, never()).triggerMutationRefresh();
    }

    @Test
    void addCommentUsesGitAuthorAndLeavesGateAlone() throws Exception {
        when(bd.gitUserName(Path.of("/work"))).thenReturn("Ana");
        when(bd.run(any(), eq(ws))).thenReturn(BdResult.of(0, "", ""));
        when(bd.runJson(eq(List.of("comments", "UI-1", "--json")), eq(ws)))
                .thenReturn(BdResult.of(0, "[]", "").withJson(mapper.readTree("[{\"text\":\"hi\"}]")));

        Object reply = service.apply(MessageType.ADD_COMMENT, json("{\"id\":\"UI-1\",\"text\":\" hi \"}"));

        verify(bd).run(List.of("comment", "UI-1", "hi", "--author", "Ana"), ws);
        assertThat(((JsonNode) reply).get(0).get("text").asText()).isEqualTo("hi");
        verifyNoInteractions(scheduler);
    }

    @Test
    void emptyCommentListWhenBdPrintsNothing() throws Exception {
        when(bd.runJson(eq(List.of("comments", "UI-1", "--json")), eq(ws)))
                .thenReturn(BdResult.of(0, "", "").withJson(mapper.readTree("null")));

        assertThat(service.apply(MessageType.GET_COMMENTS, json("{\"id\":\"UI-1\"}"))).isEqualTo(List.of());
    }

    @Test
    void handlesOnlyMutationTypes() {
        assertThat(service.handles(MessageType.DEP_REMOVE)).isTrue();
        assertThat(service.handles(MessageType.SUBSCRIBE_LIST)).isFalse();
    }
}
