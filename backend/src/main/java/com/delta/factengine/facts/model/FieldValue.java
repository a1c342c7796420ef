package com.delta.factengine.facts.model;

public record FieldValue(double value, String currency) {
}
