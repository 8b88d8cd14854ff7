package com.recall.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ClinicalPolicyTest {

    @TempDir
    Path dir;

    private Path overrides(String content) throws IOException {
        Path file = dir.resolve("policy.conf");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void classpathPolicyLoads() {
        ClinicalPolicy policy = ClinicalPolicy.load();

        assertEquals(6, policy.vitalRanges.size());
        assertEquals("hr", policy.vitalRanges.get(0).vital);
        assertEquals(5, policy.criticalStalenessMinutes);
        assertEquals(15, policy.routineStalenessMinutes);
        assertEquals(2, policy.formatter.maxActions);
        assertTrue(policy.treeFor("airway").isPresent());
        assertTrue(policy.rangeFor("spo2").isPresent());
        assertTrue(policy.rangeFor("pulse").isEmpty());
    }

    @Test
    void externalFileOverridesOnlyWhatItNames() throws IOException {
        Path file = overrides("clinical-policy.formatter.max-actions = 3\n"
            + "clinical-policy.vitals.staleness.critical-minutes = 3\n");

        ClinicalPolicy policy = ClinicalPolicy.load(Optional.of(file));

        assertEquals(3, policy.formatter.maxActions);
        assertEquals(3, policy.criticalStalenessMinutes);
        assertEquals(160, policy.formatter.maxDescriptionChars);
        assertEquals(6, policy.medications.size());
    }

    @Test
    void missingExternalFileIsRejected() {
        assertThrows(PolicyException.class, () -> ClinicalPolicy.load(Optional.of(dir.resolve("absent.conf"))));
    }

    @Test
    void emptyRangeTableIsRejected() throws IOException {
        Path file = overrides("clinical-policy.vitals.ranges = []\n");

        assertThrows(PolicyException.class, () -> ClinicalPolicy.load(Optional.of(file)));
    }

    @Test
    void cautionOnUnknownVitalIsRejected() throws IOException {
        Path file = overrides("clinical-policy.vitals.cautions = [ "
            + "{ vital = pulse, above = 120, triggers = [epinephrine], message = \"Fast\" } ]\n");

        PolicyException e = assertThrows(PolicyException.class, () -> ClinicalPolicy.load(Optional.of(file)));
        assertTrue(e.getMessage().contains("pulse"));
    }

    @Test
    void invertedGuidelineDoseBoundsAreRejected() throws IOException {
        Path file = overrides("clinical-policy.guideline-dosing.min-rate-per-kg = 5\n"
            + "clinical-policy.guideline-dosing.max-rate-per-kg = 1\n");

        assertThrows(PolicyException.class, () -> ClinicalPolicy.load(Optional.of(file)));
    }

    @Test
    void wrongValueTypeIsReportedAsPolicyError() throws IOException {
        Path file = overrides("clinical-policy.formatter.max-actions = many\n");

        assertThrows(PolicyException.class, () -> ClinicalPolicy.load(Optional.of(file)));
    }
}
