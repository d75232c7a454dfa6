package gpulane.coordinator.validation;

import gpulane.coordinator.config.ModelCatalog;
import gpulane.coordinator.model.GenerationRequest;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintValidatorTest {

    private static ConstraintValidator validator;

    @BeforeAll
    static void setup() {
        validator = new ConstraintValidator(ModelCatalog.loadDefault());
    }

    private static GenerationRequest request(String model, String mode, Map<String, Object> params) {
        return new GenerationRequest(model, null, mode, "a red fox in the snow", params, Instant.now());
    }

    @Test
    void wrongFixedStepsRejected() {
        ValidationResult result = validator.validate(request("anisora", null, Map.of("steps", 6)));

        assertFalse(result.valid());
        assertEquals("steps", result.field());
        assertEquals("8", result.expected());
        assertEquals("6", result.actual());
        assertEquals("For anisora, steps must be exactly 8 (got 6).", result.message());
    }

    @Test
    void exactFixedStepsAccepted() {
        ValidationResult result = validator.validate(request("anisora", null, Map.of("steps", 8)));

        assertTrue(result.valid());
        assertEquals("t2v", result.mode());
        assertEquals(8, result.normalizedParameters().get("steps"));
    }

    @Test
    void integralDoubleMatchesFixedSteps() {
        assertTrue(validator.validate(request("anisora", null, Map.of("steps", 8.0))).valid());
        assertFalse(validator.validate(request("anisora", null, Map.of("steps", 8.5))).valid());
    }

    @Test
    void missingFixedParametersAreFilledIn() {
        ValidationResult result = validator.validate(request("phr00t", null, Map.of()));

        assertTrue(result.valid());
        assertEquals(4, result.normalizedParameters().get("steps"));
        assertEquals(1.0, result.normalizedParameters().get("cfg_scale"));
    }

    @Test
    void wrongFixedCfgRejected() {
        ValidationResult result = validator.validate(request("phr00t", null, Map.of("steps", 4, "cfg_scale", 7.5)));

        assertFalse(result.valid());
        assertEquals("cfg_scale", result.field());
        assertEquals("For phr00t, cfg_scale must be exactly 1.0 (got 7.5).", result.message());
    }

    @Test
    void cfgAliasesAreReadAsCfgScale() {
        assertFalse(validator.validate(request("phr00t", null, Map.of("cfg", 3))).valid());
        assertFalse(validator.validate(request("phr00t", null, Map.of("guidance_scale", 3.5))).valid());
        assertTrue(validator.validate(request("phr00t", null, Map.of("cfg", 1))).valid());
    }

    @Test
    void nullCfgScaleDoesNotHideAlias() {
        Map<String, Object> params = new HashMap<>();
        params.put("cfg_scale", null);
        params.put("cfg", 7.0);

        ValidationResult result = validator.validate(request("phr00t", null, params));

        assertFalse(result.valid());
        assertEquals("cfg_scale", result.field());
        assertEquals("1.0", result.expected());
        assertEquals("7.0", result.actual());
    }

    @Test
    void nonNumericStepsRejected() {
        ValidationResult result = validator.validate(request("anisora", null, Map.of("steps", "8")));
        assertFalse(result.valid());
        assertEquals("steps", result.field());
    }

    @Test
    void unknownModelRejected() {
        ValidationResult result = validator.validate(request("sdxl", null, Map.of()));

        assertFalse(result.valid());
        assertEquals("model", result.field());
        assertEquals("sdxl", result.actual());
    }

    @Test
    void typeMismatchRejected() {
        GenerationRequest req = new GenerationRequest("anisora", "image", null, "prompt", Map.of(), Instant.now());
        ValidationResult result = validator.validate(req);

        assertFalse(result.valid());
        assertEquals("type", result.field());
        assertEquals("video", result.expected());
    }

    @Test
    void unsupportedModeRejected() {
        ValidationResult result = validator.validate(request("phr00t", "arbitrary_frame", Map.of()));

        assertFalse(result.valid());
        assertEquals("mode", result.field());
    }

    @Test
    void emptyPromptRejected() {
        GenerationRequest req = new GenerationRequest("pony", null, null, "  ", Map.of(), Instant.now());
        ValidationResult result = validator.validate(req);

        assertFalse(result.valid());
        assertEquals("prompt", result.field());
    }

    @Test
    void overlongPromptRejected() {
        String prompt = "x".repeat(ConstraintValidator.MAX_PROMPT_LENGTH + 1);
        GenerationRequest req = new GenerationRequest("pony", null, null, prompt, Map.of(), Instant.now());

        assertFalse(validator.validate(req).valid());
    }

    @Test
    void imageToVideoNeedsReferenceImage() {
        assertFalse(validator.validate(request("anisora", "i2v", Map.of())).valid());
        assertTrue(validator.validate(request("anisora", "i2v", Map.of("reference_image", "data:image/png;base64,AAAA")))
                .valid());
    }

    @Test
    void firstLastFrameNeedsBothFrames() {
        ValidationResult result = validator.validate(request("anisora", "first_last_frame",
                Map.of("first_frame_image", "a")));

        assertFalse(result.valid());
        assertEquals("first_frame_image", result.field());
    }

    @Test
    void arbitraryFrameNeedsFrames() {
        assertFalse(validator.validate(request("anisora", "arbitrary_frame",
                Map.of("arbitrary_frames", List.of()))).valid());
        assertTrue(validator.validate(request("anisora", "arbitrary_frame",
                Map.of("arbitrary_frames", List.of(Map.of("index", 0, "image", "a"))))).valid());
    }

    @Test
    void imageModelHasNoFixedParameters() {
        ValidationResult result = validator.validate(request("flux", null, Map.of("steps", 30)));

        assertTrue(result.valid());
        assertEquals("txt2img", result.mode());
        assertEquals(30, result.normalizedParameters().get("steps"));
    }
}
