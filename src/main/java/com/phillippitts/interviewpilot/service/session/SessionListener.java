package com.phillippitts.interviewpilot.service.session;

import com.phillippitts.interviewpilot.domain.BudgetState;
import com.phillippitts.interviewpilot.domain.Exchange;
import com.phillippitts.interviewpilot.domain.TransitionLogEntry;

import java.util.List;

/**
 * Observer of a {@link SessionStateMachine}. Callbacks run after the state machine's lock is
 * released, in the order the changes happened. They may run on another thread than the one that
 * made the change. A change made from inside a callback is delivered once that callback returns.
 */
public interface SessionListener {

    default void onTransition(TransitionLogEntry entry) {
    }

    default void onExchange(Exchange exchange) {
    }

    default void onBudgetExhausted(List<String> skippedItemIds, BudgetState budget) {
    }
}
