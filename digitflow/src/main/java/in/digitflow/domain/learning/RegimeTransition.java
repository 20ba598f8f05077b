package in.digitflow.domain.learning;

import in.digitflow.domain.signal.Regime;

import java.time.Instant;

public record RegimeTransition(Regime from, Regime to, Instant at) {}
