package org.javai.bpmncode.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;
import org.javai.bpmncode.config.CheckerSettings;

/**
 * "Did you mean" suggestions based on Jaro-Winkler similarity.
 * <p>
 * Two thresholds apply. {@link CheckerSettings#similarityThreshold()} (0.6 by default) bounds what
 * may be suggested at all; {@link CheckerSettings#keywordTypoThreshold()} (0.75) is the stricter
 * bar for naming a single keyword as the confident correction.
 */
public class SuggestionEngine {

	private final JaroWinklerSimilarity similarity = new JaroWinklerSimilarity();
	private final CheckerSettings settings;

	public SuggestionEngine(CheckerSettings settings) {
		if (settings == null) {
			throw new IllegalArgumentException("Settings cannot be null");
		}
		this.settings = settings;
	}

	public static SuggestionEngine withDefaults() {
		return new SuggestionEngine(CheckerSettings.defaults());
	}

	public CheckerSettings settings() {
		return settings;
	}

	/**
	 * Similarity of two strings in [0, 1]; 1 means identical.
	 */
	public double score(String target, String candidate) {
		return similarity.apply(target, candidate);
	}

	/**
	 * Ranks {@code candidates} by similarity to {@code target}.
	 *
	 * @return at most {@code limit} candidates scoring above the similarity threshold, best
	 * first; equal scores keep candidate order
	 */
	public List<String> suggestSimilar(String target, Collection<String> candidates, int limit) {
		if (target == null || candidates == null || candidates.isEmpty() || limit <= 0) {
			return List.of();
		}

		List<Scored> scored = new ArrayList<>();
		for (String candidate : candidates) {
			double value = score(target, candidate);
			if (value > settings.similarityThreshold()) {
				scored.add(new Scored(candidate, value));
			}
		}

		// List.sort is stable
		scored.sort(Comparator.comparingDouble(Scored::score).reversed());

		return scored.stream()
				.limit(limit)
				.map(Scored::candidate)
				.toList();
	}

	/**
	 * The keyword {@code target} was most likely meant to be, if the match is confident.
	 */
	public Optional<String> detectKeywordTypo(String target) {
		if (target == null) {
			return Optional.empty();
		}

		String best = null;
		double bestScore = -1;
		for (String keyword : settings.keywords()) {
			double value = score(target, keyword);
			if (value > bestScore) {
				best = keyword;
				bestScore = value;
			}
		}

		return bestScore > settings.keywordTypoThreshold() ? Optional.of(best) : Optional.empty();
	}

	/**
	 * Whether {@code target} resembles some keyword without being one.
	 */
	public boolean isLikelyKeywordTypo(String target) {
		if (target == null) {
			return false;
		}
		return settings.keywords().stream()
				.mapToDouble(keyword -> score(target, keyword))
				.anyMatch(value -> value > settings.similarityThreshold() && value < 1.0);
	}

	public List<String> suggestKeywords(String target) {
		return suggestSimilar(target, settings.keywords(), settings.maxSuggestions());
	}

	public List<String> suggestEventTypes(String target) {
		return suggestSimilar(target, settings.eventTypes(), settings.maxSuggestions());
	}

	public List<String> suggestFlowOperators(String target) {
		return suggestSimilar(target, settings.flowOperators(), settings.maxFlowSuggestions());
	}

	public List<String> suggestAttributes(String target) {
		return suggestSimilar(target, settings.attributeNames(), settings.maxSuggestions());
	}

	/**
	 * Suggestions drawn from identifiers declared in the source, e.g. for an unknown flow target.
	 */
	public List<String> suggestIdentifiers(String target, Collection<String> identifiers) {
		return suggestSimilar(target, identifiers, settings.maxSuggestions());
	}

	private record Scored(String candidate, double score) {
	}
}
