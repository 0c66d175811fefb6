package eu.virtualparadox.ragqa.web;

public record EvaluationRequest(String question, String groundTruth, String generatedAnswer) {
}
