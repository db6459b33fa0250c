package org.javai.bpmncode.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link CheckerSettings} from YAML.
 * <p>
 * Every key is optional; a missing key keeps the built-in default. Example:
 *
 * <pre>
 * suggestions:
 *   similarity_threshold: 0.6
 *   keyword_typo_threshold: 0.75
 * parser:
 *   max_nesting_depth: 64
 * candidates:
 *   attribute_names: [timeout, assignee]
 * </pre>
 */
public class CheckerSettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(CheckerSettingsLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/bpmncode-settings.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the bundled settings resource, falling back to {@link CheckerSettings#defaults()} when
	 * the resource is not on the class path.
	 */
	public CheckerSettings loadDefault(ClassLoader loader) {
		ClassLoader effective = loader != null ? loader : CheckerSettingsLoader.class.getClassLoader();
		try (InputStream stream = effective.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (stream == null) {
				logger.debug("No {} on the class path; using built-in settings", DEFAULT_RESOURCE);
				return CheckerSettings.defaults();
			}
			CheckerSettings settings = parse(stream);
			logger.debug("Loaded checker settings from {}", DEFAULT_RESOURCE);
			return settings;
		} catch (CheckerSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new CheckerSettingsException("Failed to read settings resource " + DEFAULT_RESOURCE, e);
		}
	}

	/**
	 * Parse settings from a YAML file.
	 */
	public CheckerSettings parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (CheckerSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new CheckerSettingsException("Failed to parse checker settings from path: " + path, e);
		}
	}

	/**
	 * Parse settings from an input stream.
	 */
	public CheckerSettings parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildSettings(data);
		} catch (CheckerSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new CheckerSettingsException("Failed to parse checker settings from input stream", e);
		}
	}

	/**
	 * Parse settings from a reader.
	 */
	public CheckerSettings parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildSettings(data);
		} catch (CheckerSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new CheckerSettingsException("Failed to parse checker settings from reader", e);
		}
	}

	/**
	 * Parse settings from a YAML string.
	 */
	public CheckerSettings parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildSettings(data);
		} catch (CheckerSettingsException e) {
			throw e;
		} catch (Exception e) {
			throw new CheckerSettingsException("Failed to parse checker settings from string", e);
		}
	}

	private CheckerSettings buildSettings(Map<String, Object> data) {
		CheckerSettings defaults = CheckerSettings.defaults();
		if (data == null) {
			return defaults;
		}

		Map<String, Object> suggestions = section(data, "suggestions");
		Map<String, Object> parser = section(data, "parser");
		Map<String, Object> context = section(data, "context");
		Map<String, Object> candidates = section(data, "candidates");

		try {
			return new CheckerSettings(
				doubleValue(suggestions, "similarity_threshold", defaults.similarityThreshold()),
				doubleValue(suggestions, "keyword_typo_threshold", defaults.keywordTypoThreshold()),
				intValue(suggestions, "max_suggestions", defaults.maxSuggestions()),
				intValue(suggestions, "max_flow_suggestions", defaults.maxFlowSuggestions()),
				intValue(parser, "max_condition_tokens", defaults.maxConditionTokens()),
				intValue(parser, "max_nesting_depth", defaults.maxNestingDepth()),
				intValue(context, "gateway_lookahead", defaults.gatewayLookahead()),
				stringList(candidates, "keywords", defaults.keywords()),
				stringList(candidates, "event_types", defaults.eventTypes()),
				stringList(candidates, "flow_operators", defaults.flowOperators()),
				stringList(candidates, "attribute_names", defaults.attributeNames())
			);
		} catch (IllegalArgumentException e) {
			throw new CheckerSettingsException("Invalid checker settings: " + e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> section(Map<String, Object> data, String name) {
		Object value = data.get(name);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new CheckerSettingsException("Settings section '" + name + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private double doubleValue(Map<String, Object> section, String key, double fallback) {
		Object value = section.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof Number)) {
			throw new CheckerSettingsException("Setting '" + key + "' must be a number, got: " + value);
		}
		return ((Number) value).doubleValue();
	}

	private int intValue(Map<String, Object> section, String key, int fallback) {
		Object value = section.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof Integer)) {
			throw new CheckerSettingsException("Setting '" + key + "' must be an integer, got: " + value);
		}
		return (Integer) value;
	}

	private List<String> stringList(Map<String, Object> section, String key, List<String> fallback) {
		Object value = section.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof List<?> list)) {
			throw new CheckerSettingsException("Setting '" + key + "' must be a list");
		}
		return list.stream().map(String::valueOf).collect(Collectors.toList());
	}
}
