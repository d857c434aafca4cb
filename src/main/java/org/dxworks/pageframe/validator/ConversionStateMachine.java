package org.dxworks.pageframe.validator;

import org.dxworks.pageframe.model.ConversionState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Lifecycle of one conversion: pending, converting, validating, then done.
 * Any non-terminal state may fail. Not thread-safe; each conversion owns one.
 */
public class ConversionStateMachine {

    private ConversionState state = ConversionState.PENDING;
    private final List<ConversionState> history = new ArrayList<>(List.of(ConversionState.PENDING));

    public ConversionState state() {
        return state;
    }

    public List<ConversionState> history() {
        return Collections.unmodifiableList(history);
    }

    public boolean isTerminal() {
        return state == ConversionState.DONE || state == ConversionState.FAILED;
    }

    public void transition(ConversionState next) {
        if (!allowed(state).contains(next)) {
            throw new IllegalStateException("Illegal conversion state transition: " + state.getId()
                    + " -> " + next.getId());
        }
        state = next;
        history.add(next);
    }

    public void fail() {
        transition(ConversionState.FAILED);
    }

    static Set<ConversionState> allowed(ConversionState from) {
        return switch (from) {
            case PENDING -> EnumSet.of(ConversionState.CONVERTING, ConversionState.FAILED);
            case CONVERTING -> EnumSet.of(ConversionState.VALIDATING, ConversionState.FAILED);
            case VALIDATING -> EnumSet.of(ConversionState.DONE, ConversionState.FAILED);
            case DONE, FAILED -> EnumSet.noneOf(ConversionState.class);
        };
    }
}
