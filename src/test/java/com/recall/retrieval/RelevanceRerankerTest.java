package com.recall.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.recall.support.TestEngines;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RelevanceRerankerTest {

    private LexicalRanker ranker;
    private RelevanceReranker reranker;

    @BeforeEach
    void setUp() {
        ranker = TestEngines.ranker();
        reranker = TestEngines.reranker(ranker);
    }

    @Test
    void dosageBearingTextOutranksBoilerplateHeader() {
        List<CorpusEntry> corpus = ranker.entries();
        List<ScoredEntry> candidates = List.of(
            new ScoredEntry(corpus.get(0), 0, 5.0),
            new ScoredEntry(corpus.get(1), 1, 1.0));

        List<ScoredEntry> reranked = reranker.rerank(candidates, "txa");

        // header: three boilerplate words; TXA passage: dosage, one medication, two action verbs
        assertEquals(1, reranked.get(0).index);
        assertEquals(8.0, reranked.get(0).score, 1e-9);
        assertEquals(0, reranked.get(1).index);
        assertEquals(-1.0, reranked.get(1).score, 1e-9);
    }

    @Test
    void shortTextIsPenalized() {
        CorpusEntry shortEntry = new CorpusEntry("Give 1 mg.", "", "", "", 0, 0.0);

        List<ScoredEntry> reranked = reranker.rerank(List.of(new ScoredEntry(shortEntry, 0, 0.0)), "dose");

        assertEquals(1.0, reranked.get(0).score, 1e-9);
    }

    @Test
    void equalAdjustedScoresKeepIncomingOrder() {
        CorpusEntry a = new CorpusEntry("Reassess the casualty frequently during evacuation to the next role.", "", "", "", 0, 0.0);
        CorpusEntry b = new CorpusEntry("Document findings on the casualty card before handing over to the team.", "", "", "", 0, 0.0);

        List<ScoredEntry> reranked = reranker.rerank(
            List.of(new ScoredEntry(a, 7, 2.0), new ScoredEntry(b, 3, 2.0)), "casualty");

        assertEquals(7, reranked.get(0).index);
        assertEquals(3, reranked.get(1).index);
    }

    @Test
    void keywordFallbackScoresSourceAndVariations() {
        List<ScoredEntry> results = reranker.keywordFallback("tbi", 5);

        // source hit (+3) plus brain, traumatic, injury variations (+2 each)
        assertEquals(5, results.get(0).index);
        assertEquals(9.0, results.get(0).score, 1e-9);
        assertEquals(2, results.size());
        assertEquals(1, results.get(1).index);
    }

    @Test
    void keywordFallbackReturnsNothingWithoutOverlap() {
        assertTrue(reranker.keywordFallback("circulation", 5).isEmpty());
        assertTrue(reranker.keywordFallback("", 5).isEmpty());
    }

    @Test
    void keywordFallbackTruncatesToTopN() {
        List<ScoredEntry> results = reranker.keywordFallback("hemorrhage adult", 2);

        assertEquals(2, results.size());
        assertTrue(results.get(0).score >= results.get(1).score);
    }
}
