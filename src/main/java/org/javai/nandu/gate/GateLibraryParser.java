package org.javai.nandu.gate;

import java.io.InputStream;
import java.io.Reader;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for gate library YAML documents:
 *
 * <pre>
 * primitive: Nand
 * gates:
 *   - name: Nand
 *     arity: 2
 *     template: "Nand(param0, param1)"
 *   - name: Not
 *     arity: 1
 *     template: "Nand(param0, param0)"
 * </pre>
 */
public class GateLibraryParser {

	private static final Logger logger = LoggerFactory.getLogger(GateLibraryParser.class);

	private final Yaml yaml = new Yaml();

	/**
	 * Parse a gate library from an input stream.
	 */
	public GateLibrary parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildLibrary(data);
		} catch (Exception e) {
			throw new IllegalStateException("Failed to parse gate library from input stream", e);
		}
	}

	/**
	 * Parse a gate library from a reader.
	 */
	public GateLibrary parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildLibrary(data);
		} catch (Exception e) {
			throw new IllegalStateException("Failed to parse gate library from reader", e);
		}
	}

	/**
	 * Parse a gate library from a string.
	 */
	public GateLibrary parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildLibrary(data);
		} catch (Exception e) {
			throw new IllegalStateException("Failed to parse gate library from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private GateLibrary buildLibrary(Map<String, Object> data) {
		if (data == null) {
			throw new IllegalArgumentException("Gate library document is empty");
		}
		Object primitive = data.get("primitive");
		if (!(primitive instanceof String)) {
			throw new IllegalArgumentException("Gate library is missing 'primitive'");
		}
		Object gates = data.get("gates");
		if (!(gates instanceof List)) {
			throw new IllegalArgumentException("Gate library is missing the 'gates' list");
		}

		GateLibrary.Builder builder = GateLibrary.builder((String) primitive);
		for (Object entry : (List<Object>) gates) {
			if (!(entry instanceof Map)) {
				throw new IllegalArgumentException("Gate entry must be a mapping: " + entry);
			}
			Map<String, Object> gate = (Map<String, Object>) entry;
			String name = requireString(gate, "name");
			int arity = requireInt(gate, "arity", name);
			String template = requireString(gate, "template");
			logger.debug("Loaded definition of gate '{}': {}", name, template);
			builder.define(name, arity, template);
		}
		return builder.build();
	}

	private String requireString(Map<String, Object> gate, String key) {
		Object value = gate.get(key);
		if (!(value instanceof String) || ((String) value).isBlank()) {
			throw new IllegalArgumentException("Gate entry is missing '" + key + "': " + gate);
		}
		return (String) value;
	}

	private int requireInt(Map<String, Object> gate, String key, String name) {
		Object value = gate.get(key);
		if (!(value instanceof Integer)) {
			throw new IllegalArgumentException("Gate '" + name + "' is missing an integer '" + key + "'");
		}
		return (Integer) value;
	}
}
