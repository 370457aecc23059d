package com.ryuqq.stepflow.core.gate;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * ThresholdGate 테스트.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ThresholdGateTest {

    @Mock
    private GateAction publish;

    private final ThresholdGate gate = new ThresholdGate("test_accuracy");

    @Test
    void evaluate_MetricAboveThreshold_RunsActionAndPublishes() throws Exception {
        // When
        GateDecision decision = gate.evaluate(0.82, 0.7, publish);

        // Then
        assertEquals(GateDecision.PUBLISHED, decision);
        assertTrue(decision.isPublished());
        verify(publish).run();
    }

    @Test
    void evaluate_MetricEqualToThreshold_Publishes() throws Exception {
        assertEquals(GateDecision.PUBLISHED, gate.evaluate(0.7, 0.7, publish));
        verify(publish).run();
    }

    @Test
    void evaluate_MetricBelowThreshold_SkipsWithoutError() throws Exception {
        // When
        GateDecision decision = gate.evaluate(0.7, 0.75, publish);

        // Then
        assertEquals(GateDecision.SKIPPED, decision);
        assertFalse(decision.isPublished());
        verifyNoInteractions(publish);
    }

    @Test
    void evaluate_NaNMetric_NeverOpens() throws Exception {
        assertEquals(GateDecision.SKIPPED, gate.evaluate(Double.NaN, 0.0, publish));
        verifyNoInteractions(publish);
    }

    @Test
    void evaluate_ActionFails_PropagatesException() throws Exception {
        // Given
        IOException failure = new IOException("registry unavailable");
        doThrow(failure).when(publish).run();

        // When & Then
        IOException exception = assertThrows(IOException.class, () -> gate.evaluate(0.9, 0.7, publish));
        assertSame(failure, exception);
    }

    @Test
    void evaluate_NaNThreshold_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> gate.evaluate(0.9, Double.NaN, publish)
        );
        assertTrue(exception.getMessage().contains("threshold cannot be NaN"));
    }

    @Test
    void constructor_BlankMetricName_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new ThresholdGate(" "));
    }
}
