package io.prime.core.scoring;

/// Overall score and confidence across the five domains.
///
/// @param primeScore mean domain score, null when too few domains are scored
/// @param primeConfidence mean domain confidence in [0,100]
/// @param scoredDomains number of domains with a score
public record PrimeAggregate(Double primeScore, double primeConfidence, int scoredDomains) {}
