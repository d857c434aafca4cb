package org.dxworks.pageframe.validator;

import org.dxworks.pageframe.model.ConversionState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversionStateMachineTest {

    @Test
    void happyPath_endsDone() {
        ConversionStateMachine machine = new ConversionStateMachine();
        assertFalse(machine.isTerminal());

        machine.transition(ConversionState.CONVERTING);
        machine.transition(ConversionState.VALIDATING);
        machine.transition(ConversionState.DONE);

        assertTrue(machine.isTerminal());
        assertEquals(List.of(ConversionState.PENDING, ConversionState.CONVERTING, ConversionState.VALIDATING,
                ConversionState.DONE), machine.history());
    }

    @Test
    void anyOpenState_canFail() {
        ConversionStateMachine machine = new ConversionStateMachine();
        machine.transition(ConversionState.CONVERTING);

        machine.fail();

        assertEquals(ConversionState.FAILED, machine.state());
        assertThrows(IllegalStateException.class, machine::fail);
    }

    @Test
    void skippingStates_isRejected() {
        ConversionStateMachine machine = new ConversionStateMachine();

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> machine.transition(ConversionState.DONE));
        assertEquals("Illegal conversion state transition: pending -> done", error.getMessage());
        assertEquals(ConversionState.PENDING, machine.state());
    }

    @Test
    void doneIsFinal() {
        ConversionStateMachine machine = new ConversionStateMachine();
        machine.transition(ConversionState.CONVERTING);
        machine.transition(ConversionState.VALIDATING);
        machine.transition(ConversionState.DONE);

        assertThrows(IllegalStateException.class, () -> machine.transition(ConversionState.CONVERTING));
    }
}
