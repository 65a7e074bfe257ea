package io.b2mash.shopcredits.credit;

/** Identity of a generated credit row; overrides are keyed on it. */
public record CreditRowKey(String roNumber, String fromStage, String toStage, String note) {}
