package me.personabot.domain.orchestrator;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.personabot.domain.exception.InvariantViolationException;
import me.personabot.domain.model.CancellationToken;
import me.personabot.domain.model.InteractionOutcome;
import me.personabot.domain.model.InteractionRequest;
import me.personabot.domain.model.InteractionState;
import me.personabot.domain.model.ReplyHandle;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle of one interaction from arrival to its terminal reply.
 *
 * <p>
 * Owned by the task processing the request. Guards the invariants of the
 * two-phase reply: transitions follow {@link InteractionState}, the
 * acknowledgment is edited at most once, and nothing is sent once a terminal
 * state is reached. Violations raise {@link InvariantViolationException}.
 */
public class DeferredInteraction {

    private final InteractionRequest request;
    private final Instant ackDeadline;
    private final Duration completionBudget;

    private final AtomicReference<InteractionState> state = new AtomicReference<>(InteractionState.RECEIVED);
    private final AtomicBoolean acknowledgmentEdited = new AtomicBoolean(false);
    private final AtomicInteger sends = new AtomicInteger();

    private volatile ReplyHandle handle;
    private volatile Instant completionDeadline;
    private volatile CancellationToken cancellationToken;
    private volatile InteractionOutcome outcome;
    private volatile String label;
    private volatile String persona;

    public DeferredInteraction(InteractionRequest request, Duration ackBudget, Duration completionBudget) {
        this.request = request;
        this.ackDeadline = request.getReceivedAt().plus(ackBudget);
        this.completionBudget = completionBudget;
    }

    public InteractionRequest getRequest() {
        return request;
    }

    public InteractionState getState() {
        return state.get();
    }

    public void transition(InteractionState target) {
        while (true) {
            InteractionState current = state.get();
            if (!current.canTransitionTo(target)) {
                throw new InvariantViolationException("Illegal transition " + current + " -> " + target
                        + " for interaction " + request.getId());
            }
            if (state.compareAndSet(current, target)) {
                return;
            }
        }
    }

    /**
     * Record the acknowledgment and start the completion deadline.
     */
    public void acknowledged(ReplyHandle replyHandle, Instant at) {
        if (handle != null) {
            throw new InvariantViolationException("Interaction " + request.getId() + " acknowledged twice");
        }
        this.handle = replyHandle;
        this.completionDeadline = at.plus(completionBudget);
    }

    public boolean isAcknowledged() {
        return handle != null;
    }

    public ReplyHandle getHandle() {
        return handle;
    }

    public Instant getAckDeadline() {
        return ackDeadline;
    }

    public Instant getCompletionDeadline() {
        return completionDeadline;
    }

    /**
     * Time left before the completion deadline, never negative.
     */
    public Duration remainingCompletion(Instant now) {
        if (completionDeadline == null) {
            return completionBudget;
        }
        Duration remaining = Duration.between(now, completionDeadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Fail fast if a send is attempted after a terminal state.
     */
    public void checkSendAllowed(String operation) {
        InteractionState current = state.get();
        if (current.isTerminal()) {
            throw new InvariantViolationException("Refusing " + operation + " in terminal state " + current
                    + " for interaction " + request.getId());
        }
        sends.incrementAndGet();
    }

    /**
     * Claim the single permitted edit of the acknowledgment.
     */
    public void claimAcknowledgmentEdit() {
        if (handle == null) {
            throw new InvariantViolationException("Edit before acknowledgment for interaction " + request.getId());
        }
        if (!acknowledgmentEdited.compareAndSet(false, true)) {
            throw new InvariantViolationException("Acknowledgment already edited for interaction "
                    + request.getId());
        }
    }

    public boolean isAcknowledgmentEdited() {
        return acknowledgmentEdited.get();
    }

    public int getSendCount() {
        return sends.get();
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public void setCancellationToken(CancellationToken cancellationToken) {
        this.cancellationToken = cancellationToken;
    }

    public InteractionOutcome getOutcome() {
        return outcome;
    }

    public void setOutcome(InteractionOutcome outcome) {
        this.outcome = outcome;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getPersona() {
        return persona;
    }

    public void setPersona(String persona) {
        this.persona = persona;
    }
}
