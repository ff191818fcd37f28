package org.javai.nandu.cli;

import java.io.InputStream;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Limits the command line applies before lowering an expression. Lowered output
 * grows exponentially with nesting, so inputs beyond these limits are refused.
 *
 * @param maxNestingDepth deepest call nesting accepted in the input
 * @param maxOutputNodes largest lowered tree, in nodes, the command will build
 */
public record NanduCliConfig(int maxNestingDepth, long maxOutputNodes) {

	private static final Logger logger = LoggerFactory.getLogger(NanduCliConfig.class);

	public static final String RESOURCE = "nandu-cli.yml";
	public static final String MAX_NESTING_DEPTH_PROPERTY = "nandu.maxNestingDepth";
	public static final String MAX_OUTPUT_NODES_PROPERTY = "nandu.maxOutputNodes";

	public static final NanduCliConfig DEFAULTS = new NanduCliConfig(64, 5_000_000L);

	public NanduCliConfig {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
		}
		if (maxOutputNodes < 1) {
			throw new IllegalArgumentException("maxOutputNodes must be positive: " + maxOutputNodes);
		}
	}

	/**
	 * Load {@value #RESOURCE} from the classpath, falling back to {@link #DEFAULTS},
	 * then apply system property overrides.
	 */
	public static NanduCliConfig load() {
		return load(NanduCliConfig.class.getClassLoader());
	}

	public static NanduCliConfig load(ClassLoader loader) {
		NanduCliConfig config = DEFAULTS;
		try (InputStream is = loader.getResourceAsStream(RESOURCE)) {
			if (is == null) {
				logger.debug("No {} on the classpath; using defaults", RESOURCE);
			} else {
				Map<String, Object> data = new Yaml().load(is);
				config = fromMap(data);
			}
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load configuration from resource: " + RESOURCE, e);
		}
		return config.withOverrides(System.getProperty(MAX_NESTING_DEPTH_PROPERTY),
				System.getProperty(MAX_OUTPUT_NODES_PROPERTY));
	}

	static NanduCliConfig fromMap(Map<String, Object> data) {
		if (data == null) {
			return DEFAULTS;
		}
		int depth = DEFAULTS.maxNestingDepth();
		long nodes = DEFAULTS.maxOutputNodes();
		Object depthValue = data.get("maxNestingDepth");
		if (depthValue != null) {
			if (!(depthValue instanceof Integer)) {
				throw new IllegalArgumentException("maxNestingDepth must be an integer: " + depthValue);
			}
			depth = (Integer) depthValue;
		}
		Object nodesValue = data.get("maxOutputNodes");
		if (nodesValue != null) {
			if (!(nodesValue instanceof Number)) {
				throw new IllegalArgumentException("maxOutputNodes must be an integer: " + nodesValue);
			}
			nodes = ((Number) nodesValue).longValue();
		}
		return new NanduCliConfig(depth, nodes);
	}

	NanduCliConfig withOverrides(String depth, String nodes) {
		int newDepth = maxNestingDepth;
		long newNodes = maxOutputNodes;
		try {
			if (depth != null && !depth.isBlank()) {
				newDepth = Integer.parseInt(depth.trim());
			}
			if (nodes != null && !nodes.isBlank()) {
				newNodes = Long.parseLong(nodes.trim());
			}
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid numeric override for the command line limits", e);
		}
		return new NanduCliConfig(newDepth, newNodes);
	}
}
