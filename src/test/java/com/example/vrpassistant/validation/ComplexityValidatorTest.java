package com.example.vrpassistant.validation;

import com.example.vrpassistant.model.Break;
import com.example.vrpassistant.model.Job;
import com.example.vrpassistant.model.Resource;
import com.example.vrpassistant.model.Shift;
import com.example.vrpassistant.model.VrpProblem;
import com.example.vrpassistant.testutil.VrpFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityValidatorTest {

    private ComplexityValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ComplexityValidator();
    }

    @Test
    void testValidate_NoJobs() {
        // Given
        VrpProblem problem = VrpFixtures.problem(0, 1);

        // When
        ComplexityCheckResult result = validator.validate(problem, ComplexityLimits.DEFAULT);

        // Then
        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).contains("At least 1 job"));
        assertEquals(0, result.getActualComplexity().getJobCount());
    }

    @Test
    void testValidate_TooManyJobs() {
        // Given
        ComplexityLimits limits = new ComplexityLimits(10, 30, 5, 3);
        VrpProblem problem = VrpFixtures.problem(11, 1);

        // When
        ComplexityCheckResult result = validator.validate(problem, limits);

        // Then
        assertFalse(result.isValid());
        assertEquals("Too many jobs: 11 (maximum 10)", result.getErrors().get(0));
        assertEquals(11, result.getActualComplexity().getJobCount());
    }

    @Test
    void testValidate_ExactlyAtLimitIsValid() {
        // Given
        ComplexityLimits limits = new ComplexityLimits(10, 2, 5, 3);
        VrpProblem problem = VrpFixtures.problem(10, 2);

        // When
        ComplexityCheckResult result = validator.validate(problem, limits);

        // Then
        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertEquals(2, result.getWarnings().size());
    }

    @Test
    void testValidate_WarningAtEightyPercent() {
        // Given
        ComplexityLimits limits = new ComplexityLimits(10, 30, 5, 3);

        // When
        ComplexityCheckResult atThreshold = validator.validate(VrpFixtures.problem(8, 1), limits);
        ComplexityCheckResult belowThreshold = validator.validate(VrpFixtures.problem(7, 1), limits);

        // Then
        assertTrue(atThreshold.isValid());
        assertEquals(1, atThreshold.getWarnings().size());
        assertEquals("Approaching job limit (8/10)", atThreshold.getWarnings().get(0));
        assertTrue(belowThreshold.getWarnings().isEmpty());
    }

    @Test
    void testValidate_TooManyResources() {
        // Given
        ComplexityLimits limits = new ComplexityLimits(250, 2, 5, 3);

        // When
        ComplexityCheckResult result = validator.validate(VrpFixtures.problem(3, 3), limits);

        // Then
        assertFalse(result.isValid());
        assertEquals("Too many vehicles: 3 (maximum 2)", result.getErrors().get(0));
        assertEquals(3, result.getActualComplexity().getResourceCount());
    }

    @Test
    void testValidate_TooManyTimeWindowsOnOneJob() {
        // Given
        VrpProblem problem = VrpProblem.builder()
                .job(VrpFixtures.job("j1", 1))
                .job(VrpFixtures.job("j2", 6))
                .job(VrpFixtures.job("j3", 2))
                .resource(VrpFixtures.resource("van-1", 100))
                .build();

        // When
        ComplexityCheckResult result = validator.validate(problem, ComplexityLimits.DEFAULT);

        // Then
        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        assertEquals("Job \"j2\" has 6 time windows (maximum 5)", result.getErrors().get(0));
        assertEquals(6, result.getActualComplexity().getMaxTimeWindows());
        assertEquals(9, result.getActualComplexity().getTotalTimeWindows());
    }

    @Test
    void testValidate_UnnamedJobLabelledByIndex() {
        // Given
        Job unnamed = VrpFixtures.job("tmp", 6).toBuilder().name(null).build();
        VrpProblem problem = VrpProblem.builder()
                .job(VrpFixtures.job("j0", 1))
                .job(unnamed)
                .resource(VrpFixtures.resource("van-1", 100))
                .build();

        // When
        ComplexityCheckResult result = validator.validate(problem, ComplexityLimits.DEFAULT);

        // Then
        assertEquals("Job \"1\" has 6 time windows (maximum 5)", result.getErrors().get(0));
    }

    @Test
    void testValidate_TooManyBreaksInShift() {
        // Given
        Shift.ShiftBuilder shift = Shift.builder().from("2024-01-01T08:00:00Z").to("2024-01-01T17:00:00Z");
        for (int i = 0; i < 4; i++) {
            shift.shiftBreak(Break.builder().type("WINDOWED").duration(900).build());
        }
        Resource resource = Resource.builder().name("van-1").shift(shift.build()).build();
        VrpProblem problem = VrpProblem.builder()
                .job(VrpFixtures.job("j1", 1))
                .resource(resource)
                .build();

        // When
        ComplexityCheckResult result = validator.validate(problem, ComplexityLimits.DEFAULT);

        // Then
        assertFalse(result.isValid());
        assertEquals("Resource \"van-1\" shift 0 has 4 breaks (maximum 3)", result.getErrors().get(0));
    }

    @Test
    void testValidate_ErrorOrderForEmptyProblem() {
        // When
        ComplexityCheckResult result = validator.validate(VrpProblem.builder().build(), ComplexityLimits.DEFAULT);

        // Then
        assertEquals(2, result.getErrors().size());
        assertEquals("At least 1 job is required", result.getErrors().get(0));
        assertEquals("At least 1 vehicle/resource is required", result.getErrors().get(1));
    }

    @Test
    void testValidate_NullProblemTreatedAsEmpty() {
        // When
        ComplexityCheckResult result = validator.validate(null, ComplexityLimits.DEFAULT);

        // Then
        assertFalse(result.isValid());
        assertEquals(0, result.getActualComplexity().getResourceCount());
    }

    @Test
    void testValidate_Deterministic() {
        // Given
        VrpProblem problem = VrpFixtures.problem(5, 2);

        // When / Then
        assertEquals(validator.validate(problem, ComplexityLimits.DEFAULT),
                validator.validate(problem, ComplexityLimits.DEFAULT));
    }

    @Test
    void testFormatErrorMessage_NumbersErrors() {
        // Given
        ComplexityCheckResult result = validator.validate(VrpProblem.builder().build(), ComplexityLimits.DEFAULT);

        // When
        String message = validator.formatErrorMessage(result);

        // Then
        assertEquals("VRP problem too complex:\n\n"
                + "1. At least 1 job is required\n"
                + "2. At least 1 vehicle/resource is required", message);
    }

    @Test
    void testFormatErrorMessage_EmptyForValidResult() {
        // Given
        ComplexityCheckResult result = validator.validate(VrpFixtures.problem(2, 1), ComplexityLimits.DEFAULT);

        // When / Then
        assertEquals("", validator.formatErrorMessage(result));
    }

    @Test
    void testEstimateSolveTime() {
        // When
        double seconds = validator.estimateSolveTimeSeconds(VrpFixtures.problem(10, 2));

        // Then
        assertEquals(4.0, seconds, 1e-9);
    }

    @Test
    void testComplexityLimits_RejectsNonPositive() {
        assertThrows(IllegalArgumentException.class, () -> new ComplexityLimits(0, 30, 5, 3));
        assertThrows(IllegalArgumentException.class, () -> new ComplexityLimits(250, 30, 5, -1));
    }
}
