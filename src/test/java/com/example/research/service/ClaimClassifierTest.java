package com.example.research.service;

import com.example.research.model.ClaimType;
import com.example.research.model.Confidence;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClaimClassifierTest {

    @Test
    void uncertaintyShortCircuitsFactualMarkers() {
        assertEquals(Confidence.UNCERTAIN,
                ClaimClassifier.confidence("Revenue reportedly rose 40% in 2022 according to filings."));
        assertEquals(Confidence.UNCERTAIN, ClaimClassifier.confidence("[UNCERTAIN] The plant closed last year."));
        assertEquals(Confidence.UNCERTAIN, ClaimClassifier.confidence("It Appears the policy changed."));
    }

    @Test
    void factualMarkerCountDrivesConfidence() {
        assertEquals(Confidence.HIGH, ClaimClassifier.confidence("The study found a $4,500 saving per household."));
        assertEquals(Confidence.MEDIUM, ClaimClassifier.confidence("Prices fell 12.5% over the period."));
        assertEquals(Confidence.LOW, ClaimClassifier.confidence("Prices fell sharply over the period."));
    }

    @Test
    void repeatedMarkerCountsOnce() {
        assertEquals(Confidence.MEDIUM, ClaimClassifier.confidence("Shares rose 5% then 7% then 9%."));
    }

    @Test
    void claimTypePrecedence() {
        assertEquals(ClaimType.PREDICTION, ClaimClassifier.claimType("Analysts forecast the best year yet."));
        assertEquals(ClaimType.DEFINITION, ClaimClassifier.claimType("Net zero refers to a better balance."));
        assertEquals(ClaimType.OPINION, ClaimClassifier.claimType("Regulators should act now."));
        assertEquals(ClaimType.FACTUAL, ClaimClassifier.claimType("The factory employs 300 people."));
    }

    @Test
    void hedgedClaimWithoutPredictionMarkerIsFactual() {
        String sentence = "Experts believe costs might decline by 2030.";

        assertEquals(Confidence.UNCERTAIN, ClaimClassifier.confidence(sentence));
        assertEquals(ClaimType.FACTUAL, ClaimClassifier.claimType(sentence));
    }
}
