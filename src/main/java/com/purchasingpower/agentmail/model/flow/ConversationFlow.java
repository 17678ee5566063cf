package com.purchasingpower.agentmail.model.flow;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.purchasingpower.agentmail.exception.FlowStateException;
import com.purchasingpower.agentmail.model.mail.Email;
import com.purchasingpower.agentmail.util.MessageIds;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Persistent record of one multi-round conversation between an agent and its requester.
 *
 * <p>The whole object is stored as JSON (field access), so everything the engine needs to
 * resume after a restart lives here. State changes go through the transition methods,
 * which keep these invariants:
 * <ul>
 *   <li>{@code waitingFor} and {@code timeoutAt} are set exactly when the state is WAITING</li>
 *   <li>{@code round} never exceeds {@code maxRounds} and equals the history size</li>
 *   <li>terminal flows never change state again</li>
 * </ul>
 *
 * <p>{@code version} is not part of the JSON; the store assigns it from the optimistic lock column.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class ConversationFlow {

    private String id;
    private String agentId;
    private String teamId;
    private String userId;
    private String conversationId;
    private Email trigger;
    private Requester requester;
    private DelegationInfo delegation;

    private FlowState state;
    private int round;
    private int maxRounds;
    private int timeoutMinutes;
    private Instant timeoutAt;
    private WaitCondition waitingFor;

    private List<RoundRecord> history = new ArrayList<>();

    /**
     * Normalized ids of every message in this flow's thread, inbound and outbound.
     */
    private List<String> threadMessageIds = new ArrayList<>();

    /**
     * Reply that resumed the flow and has not yet been processed by a round.
     */
    private Email pendingInput;
    private RoundInputKind pendingInputKind;

    /**
     * Completion note or failure reason.
     */
    private String outcome;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    @JsonIgnore
    private Long version;

    public static ConversationFlow start(String id, FlowStartRequest request, String conversationId, Instant now) {
        ConversationFlow flow = new ConversationFlow();
        flow.id = id;
        flow.agentId = request.getAgentId();
        flow.teamId = request.getTeamId();
        flow.userId = request.getUserId();
        flow.conversationId = conversationId;
        flow.trigger = request.getTrigger();
        flow.requester = request.getRequester();
        flow.delegation = request.getDelegation();
        flow.state = FlowState.ACTIVE;
        flow.round = 0;
        flow.maxRounds = request.getMaxRounds();
        flow.timeoutMinutes = request.getTimeoutMinutes();
        flow.createdAt = now;
        flow.updatedAt = now;
        flow.addThreadMessageIds(request.getTrigger().getReferences());
        flow.addThreadMessageIds(request.getTrigger().getInReplyTo());
        flow.addThreadMessageId(request.getTrigger().getMessageId());
        return flow;
    }

    public List<RoundRecord> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public List<String> getThreadMessageIds() {
        return Collections.unmodifiableList(threadMessageIds);
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    @JsonIgnore
    public boolean isWaiting() {
        return state == FlowState.WAITING;
    }

    @JsonIgnore
    public boolean isLastRound() {
        return round + 1 >= maxRounds;
    }

    @JsonIgnore
    public boolean hasRoundsLeft() {
        return round < maxRounds;
    }

    /**
     * True when the flow is waiting and its deadline has passed.
     */
    public boolean isTimeoutDue(Instant now) {
        return state == FlowState.WAITING && timeoutAt != null && !now.isBefore(timeoutAt);
    }

    /**
     * Message the next round should process: the trigger for round zero, the pending reply
     * after a resume, otherwise nothing.
     */
    @JsonIgnore
    public Email getNextInput() {
        if (pendingInput != null) {
            return pendingInput;
        }
        return round == 0 ? trigger : null;
    }

    @JsonIgnore
    public RoundInputKind getNextInputKind() {
        if (pendingInput != null) {
            return pendingInputKind;
        }
        return round == 0 ? RoundInputKind.TRIGGER : RoundInputKind.CONTINUATION;
    }

    public void appendRound(RoundRecord record, Instant now) {
        requireState(FlowState.ACTIVE, FlowStateException.Reason.NOT_ACTIVE);
        if (!hasRoundsLeft()) {
            throw new FlowStateException(id, FlowStateException.Reason.ROUND_LIMIT,
                    "Round budget of " + maxRounds + " exhausted");
        }
        if (record.getIndex() != round) {
            throw new IllegalArgumentException("Round record index " + record.getIndex()
                    + " does not match round counter " + round);
        }
        history.add(record);
        round++;
        pendingInput = null;
        pendingInputKind = null;
        updatedAt = now;
    }

    public void waitFor(WaitCondition condition, Instant deadline, Instant now) {
        requireState(FlowState.ACTIVE, FlowStateException.Reason.NOT_ACTIVE);
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(deadline, "deadline");
        if (!deadline.isAfter(now)) {
            throw new IllegalArgumentException("Wait deadline must be in the future");
        }
        state = FlowState.WAITING;
        waitingFor = condition;
        timeoutAt = deadline;
        updatedAt = now;
    }

    /**
     * Leaves WAITING with the reply that satisfied the wait.
     */
    public void resume(Email input, RoundInputKind kind, Instant now) {
        requireState(FlowState.WAITING, FlowStateException.Reason.NOT_WAITING);
        state = FlowState.ACTIVE;
        waitingFor = null;
        timeoutAt = null;
        pendingInput = input;
        pendingInputKind = kind;
        addThreadMessageId(input.getMessageId());
        updatedAt = now;
    }

    public void complete(String note, Instant now) {
        requireState(FlowState.ACTIVE, FlowStateException.Reason.NOT_ACTIVE);
        finish(FlowState.COMPLETED, note, now);
    }

    public void fail(String reason, Instant now) {
        if (isTerminal()) {
            throw new FlowStateException(id, FlowStateException.Reason.NOT_ACTIVE,
                    "Flow already " + state.getValue());
        }
        finish(FlowState.FAILED, reason, now);
    }

    public void timeOut(Instant now) {
        requireState(FlowState.WAITING, FlowStateException.Reason.NOT_WAITING);
        finish(FlowState.TIMED_OUT, "No reply before " + timeoutAt, now);
    }

    public void extendTimeout(int minutes, Instant now) {
        requireState(FlowState.WAITING, FlowStateException.Reason.NOT_WAITING);
        if (minutes < 1) {
            throw new IllegalArgumentException("Extension must be at least one minute");
        }
        Instant base = timeoutAt.isAfter(now) ? timeoutAt : now;
        timeoutAt = base.plusSeconds(minutes * 60L);
        updatedAt = now;
    }

    public void addThreadMessageId(String messageId) {
        String normalized = MessageIds.normalize(messageId);
        if (!normalized.isEmpty() && !threadMessageIds.contains(normalized)) {
            threadMessageIds.add(normalized);
        }
    }

    public void addThreadMessageIds(List<String> messageIds) {
        if (messageIds != null) {
            messageIds.forEach(this::addThreadMessageId);
        }
    }

    private void finish(FlowState terminal, String note, Instant now) {
        state = terminal;
        waitingFor = null;
        timeoutAt = null;
        pendingInput = null;
        pendingInputKind = null;
        outcome = note;
        completedAt = now;
        updatedAt = now;
    }

    private void requireState(FlowState expected, FlowStateException.Reason reason) {
        if (state != expected) {
            throw new FlowStateException(id, reason,
                    "Expected state " + expected.getValue() + " but was " + state.getValue());
        }
    }
}
