// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.abi;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.radius.core.error.AbiDecodingException;
import io.radius.core.error.ConfigurationException;
import io.radius.core.error.MissingConstructorException;
import io.radius.core.error.UnknownMethodException;
import io.radius.core.model.Event;
import io.radius.core.types.Hash;
import io.radius.core.types.HexData;

final class InternalAbi implements Abi {

    private static final Logger LOG = LoggerFactory.getLogger(InternalAbi.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, AbiFunction> functions;
    private final Map<String, AbiEvent> events;
    private final @Nullable AbiFunction constructor;
    private final boolean fallback;
    private final boolean receive;

    InternalAbi(final String json) {
        if (json == null || json.isBlank()) {
            throw new ConfigurationException("ABI json must not be empty");
        }
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Unable to parse ABI json: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new ConfigurationException("ABI json must be an array");
        }

        final Map<String, AbiFunction> functionsByName = new HashMap<>();
        final Map<String, AbiEvent> eventsByName = new HashMap<>();
        AbiFunction ctor = null;
        boolean hasFallback = false;
        boolean hasReceive = false;
        for (JsonNode node : root) {
            final String type = node.path("type").asText("function").toLowerCase(Locale.ROOT);
            switch (type) {
                case "function": {
                    final AbiFunction fn = parseFunction(node);
                    if (functionsByName.putIfAbsent(fn.name(), fn) != null) {
                        throw new ConfigurationException(
                                "Overloaded functions are not supported; duplicate name '" + fn.name() + "'");
                    }
                    break;
                }
                case "event": {
                    final AbiEvent event = parseEvent(node);
                    if (eventsByName.putIfAbsent(event.name(), event) != null) {
                        throw new ConfigurationException("Duplicate event name '" + event.name() + "'");
                    }
                    break;
                }
                case "constructor":
                    if (ctor != null) {
                        throw new ConfigurationException("Multiple constructors found in ABI");
                    }
                    ctor = new AbiFunction("constructor", parseStateMutability(node),
                            parseParameters(node, "inputs"), List.of());
                    break;
                case "fallback":
                    hasFallback = true;
                    break;
                case "receive":
                    hasReceive = true;
                    break;
                default:
                    LOG.debug("Ignoring ABI entry of type '{}'", type);
            }
        }
        this.functions = Map.copyOf(functionsByName);
        this.events = Map.copyOf(eventsByName);
        this.constructor = ctor;
        this.fallback = hasFallback;
        this.receive = hasReceive;
    }

    @Override
    public HexData encodeFunction(final String name, final Object... args) {
        final AbiFunction fn = requireFunction(name);
        return HexData.fromBytes(AbiEncoder.encodeFunction(fn.signature(), fn.inputSchemas(), argList(args)));
    }

    @Override
    public List<Object> decodeFunctionResult(final String name, final byte[] data) {
        final AbiFunction fn = requireFunction(name);
        if (data == null || data.length == 0) {
            return List.of();
        }
        try {
            return AbiDecoder.decode(data, fn.outputSchemas());
        } catch (AbiDecodingException e) {
            if (fn.outputs().size() == 1 && fn.outputSchemas().get(0) instanceof TypeSchema.UIntSchema) {
                LOG.debug("Strict decode of '{}' failed ({}); reading trailing word", name, e.getMessage());
                final byte[] word = data.length > 32 ? Arrays.copyOfRange(data, data.length - 32, data.length) : data;
                return List.of(new BigInteger(1, word));
            }
            throw e;
        }
    }

    @Override
    public HexData encodeConstructor(final Object... args) {
        final List<Object> values = argList(args);
        if (constructor == null) {
            if (values.isEmpty()) {
                return HexData.EMPTY;
            }
            throw new MissingConstructorException(values.size());
        }
        return HexData.fromBytes(AbiEncoder.encode(constructor.inputSchemas(), values));
    }

    @Override
    public Optional<FunctionMetadata> function(final String name) {
        return Optional.ofNullable(functions.get(name)).map(AbiFunction::metadata);
    }

    @Override
    public Optional<Hash> eventTopicOf(final String eventName) {
        return Optional.ofNullable(events.get(eventName)).map(ev -> Abi.eventTopic(ev.signature()));
    }

    @Override
    public List<Object> decodeEvent(final String eventName, final Event log) {
        final AbiEvent event = events.get(eventName);
        if (event == null) {
            throw new AbiDecodingException("Unknown event '" + eventName + "'");
        }
        final List<Hash> topics = log.topics();
        int topicIndex = 0;
        if (!event.anonymous()) {
            final Hash expected = Abi.eventTopic(event.signature());
            if (topics.isEmpty() || !expected.equals(topics.get(0))) {
                throw new AbiDecodingException(
                        "Log topic0 does not match event '" + event.signature() + "'");
            }
            topicIndex = 1;
        }

        final List<TypeSchema> dataSchemas = new ArrayList<>();
        for (AbiParameter param : event.inputs()) {
            if (!param.indexed()) {
                dataSchemas.add(param.schema());
            }
        }
        final List<Object> dataValues = dataSchemas.isEmpty()
                ? List.of()
                : AbiDecoder.decode(log.data().toBytes(), dataSchemas);

        final List<Object> values = new ArrayList<>(event.inputs().size());
        int dataIndex = 0;
        for (AbiParameter param : event.inputs()) {
            if (!param.indexed()) {
                values.add(dataValues.get(dataIndex++));
                continue;
            }
            if (topics.size() <= topicIndex) {
                throw new AbiDecodingException("Missing topic for indexed parameter '" + param.name() + "'");
            }
            final Hash topic = topics.get(topicIndex++);
            if (isHashedWhenIndexed(param.schema())) {
                values.add(topic);
            } else {
                values.add(AbiDecoder.decode(topic.toBytes(), List.of(param.schema())).get(0));
            }
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public boolean hasConstructor() {
        return constructor != null;
    }

    @Override
    public boolean hasFallback() {
        return fallback;
    }

    @Override
    public boolean hasReceive() {
        return receive;
    }

    private AbiFunction requireFunction(final String name) {
        final AbiFunction fn = name == null ? null : functions.get(name);
        if (fn == null) {
            throw new UnknownMethodException(name);
        }
        return fn;
    }

    private static List<Object> argList(final Object[] args) {
        return args == null ? List.of() : Arrays.asList(args);
    }

    private static boolean isHashedWhenIndexed(final TypeSchema schema) {
        return schema instanceof TypeSchema.StringSchema
                || schema instanceof TypeSchema.ArraySchema
                || schema instanceof TypeSchema.TupleSchema
                || (schema instanceof TypeSchema.BytesSchema && schema.isDynamic());
    }

    private static AbiFunction parseFunction(final JsonNode node) {
        return new AbiFunction(
                requireText(node, "name", "function"),
                parseStateMutability(node),
                parseParameters(node, "inputs"),
                parseParameters(node, "outputs"));
    }

    private static AbiEvent parseEvent(final JsonNode node) {
        return new AbiEvent(
                requireText(node, "name", "event"),
                parseParameters(node, "inputs"),
                node.path("anonymous").asBoolean(false));
    }

    private static String parseStateMutability(final JsonNode node) {
        final String declared = node.path("stateMutability").asText("");
        if (!declared.isBlank()) {
            return declared.toLowerCase(Locale.ROOT);
        }
        if (node.path("constant").asBoolean(false)) {
            return "view";
        }
        return node.path("payable").asBoolean(false) ? "payable" : "nonpayable";
    }

    private static List<AbiParameter> parseParameters(final JsonNode node, final String field) {
        final JsonNode array = node.path(field);
        if (array.isMissingNode() || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new ConfigurationException("Field '" + field + "' must be an array");
        }
        final List<AbiParameter> params = new ArrayList<>(array.size());
        for (JsonNode param : array) {
            final String type = requireText(param, "type", "parameter");
            final List<AbiParameter> components = parseParameters(param, "components");
            params.add(new AbiParameter(
                    param.path("name").asText(""),
                    param.path("indexed").asBoolean(false),
                    canonicalType(type, components),
                    toSchema(type, components)));
        }
        return List.copyOf(params);
    }

    private static String requireText(final JsonNode node, final String field, final String context) {
        final JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new ConfigurationException("Field '" + field + "' is required in " + context);
        }
        return value.asText();
    }

    /**
     * Expands {@code tuple} into its component list, keeping array suffixes:
     * {@code tuple[]} with components (address,uint256) becomes {@code (address,uint256)[]}.
     */
    static String canonicalType(final String type, final List<AbiParameter> components) {
        if (!type.startsWith("tuple")) {
            return type;
        }
        final String joined = components.stream().map(AbiParameter::canonicalType).collect(Collectors.joining(","));
        return "(" + joined + ")" + type.substring("tuple".length());
    }

    static TypeSchema toSchema(final String type, final List<AbiParameter> components) {
        final String normalized = type.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("]")) {
            final int open = normalized.lastIndexOf('[');
            if (open < 0) {
                throw new ConfigurationException("Malformed array type: " + type);
            }
            final String dims = normalized.substring(open + 1, normalized.length() - 1);
            final TypeSchema element = toSchema(normalized.substring(0, open), components);
            try {
                return new TypeSchema.ArraySchema(
                        element, dims.isEmpty() ? TypeSchema.ArraySchema.DYNAMIC : Integer.parseInt(dims));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Malformed array type: " + type, e);
            }
        }
        if (normalized.equals("tuple")) {
            if (components.isEmpty()) {
                throw new ConfigurationException("Tuple type has no components");
            }
            return new TypeSchema.TupleSchema(components.stream().map(AbiParameter::schema).toList());
        }
        try {
            if (normalized.startsWith("uint")) {
                return new TypeSchema.UIntSchema(width(normalized, 4));
            }
            if (normalized.startsWith("int")) {
                return new TypeSchema.IntSchema(width(normalized, 3));
            }
            if (normalized.equals("address")) {
                return new TypeSchema.AddressSchema();
            }
            if (normalized.equals("bool")) {
                return new TypeSchema.BoolSchema();
            }
            if (normalized.equals("string")) {
                return new TypeSchema.StringSchema();
            }
            if (normalized.equals("bytes")) {
                return new TypeSchema.BytesSchema(TypeSchema.BytesSchema.DYNAMIC);
            }
            if (normalized.startsWith("bytes")) {
                return new TypeSchema.BytesSchema(Integer.parseInt(normalized.substring(5)));
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported ABI type: " + type, e);
        }
        throw new ConfigurationException("Unsupported ABI type: " + type);
    }

    private static int width(final String type, final int prefixLength) {
        return type.length() == prefixLength ? 256 : Integer.parseInt(type.substring(prefixLength));
    }

    record AbiParameter(String name, boolean indexed, String canonicalType, TypeSchema schema) {
    }

    private record AbiFunction(
            String name, String stateMutability, List<AbiParameter> inputs, List<AbiParameter> outputs) {

        String signature() {
            return name + "(" + inputs.stream().map(AbiParameter::canonicalType).collect(Collectors.joining(","))
                    + ")";
        }

        List<TypeSchema> inputSchemas() {
            return inputs.stream().map(AbiParameter::schema).toList();
        }

        List<TypeSchema> outputSchemas() {
            return outputs.stream().map(AbiParameter::schema).toList();
        }

        FunctionMetadata metadata() {
            return new FunctionMetadata(
                    name,
                    stateMutability,
                    inputs.stream().map(AbiParameter::canonicalType).toList(),
                    outputs.stream().map(AbiParameter::canonicalType).toList());
        }
    }

    private record AbiEvent(String name, List<AbiParameter> inputs, boolean anonymous) {
        String signature() {
            return name + "(" + inputs.stream().map(AbiParameter::canonicalType).collect(Collectors.joining(","))
                    + ")";
        }
    }
}
