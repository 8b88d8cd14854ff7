package com.recall.safety;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.recall.support.TestEngines;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContraindicationCheckerTest {

    private ContraindicationChecker checker;

    @BeforeEach
    void setUp() {
        checker = new ContraindicationChecker(TestEngines.POLICY.contraindications,
            TestEngines.POLICY.phrases.allergyWarning);
    }

    @Test
    void pregnancyWarnsOnKetamine() {
        assertEquals(Optional.of("Pregnancy may affect drug metabolism"),
            checker.check("ketamine for pain", Set.of("pregnancy")));
    }

    @Test
    void multipleWarningsAreJoined() {
        assertEquals(Optional.of("Pregnancy may affect drug metabolism; Epinephrine may exacerbate hypertension"),
            checker.check("morphine then epinephrine", Set.of("hypertension", "pregnancy")));
    }

    @Test
    void noActiveConditionMeansNoWarning() {
        assertTrue(checker.check("ketamine for pain", Set.of()).isEmpty());
        assertTrue(checker.check("tourniquet", Set.of("pregnancy")).isEmpty());
    }

    @Test
    void drugNamedOnlyInAnswerStillWarns() {
        Optional<String> warning = checker.check("airway intubation",
            "Prepare for RSI: ketamine 1-2mg/kg IV", List.of("pregnancy"), List.of());

        assertEquals(Optional.of("Pregnancy may affect drug metabolism"), warning);
    }

    @Test
    void recordedAllergyIsFlagged() {
        assertEquals(Optional.of("Patient is allergic to morphine"),
            checker.check("morphine", "", List.of(), List.of("morphine")));
    }

    @Test
    void asthmaWarnsOnNsaids() {
        assertEquals(Optional.of("NSAIDs may trigger asthma exacerbation"),
            checker.check("can i give nsaids", Set.of("asthma")));
    }
}
