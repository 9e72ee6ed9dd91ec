package com.newsresolver.integration.googlenews;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.newsresolver.domain.dto.SignedParams;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * The {@code garturlreq} request as the aggregator's web client sends it. Any change to the wire
 * shape belongs here and nowhere else.
 */
public final class BatchExecuteEnvelope {

    public static final String RPC_ID = "Fbv4je";
    public static final String REQUEST_TAG = "garturlreq";
    public static final String LOCALE = "US:en";

    private BatchExecuteEnvelope() {}

    /**
     * {@code ["garturlreq",[descriptor...],token,timestamp,signature]} serialized compactly.
     */
    public static String innerPayload(ObjectMapper mapper, String token, SignedParams params)
            throws JsonProcessingException {
        ArrayNode root = mapper.createArrayNode();
        root.add(REQUEST_TAG);
        root.add(descriptor(mapper));
        root.add(token);
        root.add(params.timestamp());
        root.add(params.signature());
        return mapper.writeValueAsString(root);
    }

    /**
     * {@code [[["Fbv4je", inner]]]} where inner is embedded as a JSON string.
     */
    public static String outerPayload(ObjectMapper mapper, String token, SignedParams params)
            throws JsonProcessingException {
        ArrayNode call = mapper.createArrayNode();
        call.add(RPC_ID);
        call.add(innerPayload(mapper, token, params));

        ArrayNode calls = mapper.createArrayNode();
        calls.add(call);

        ArrayNode root = mapper.createArrayNode();
        root.add(calls);
        return mapper.writeValueAsString(root);
    }

    public static String formBody(ObjectMapper mapper, String token, SignedParams params)
            throws JsonProcessingException {
        return "f.req=" + URLEncoder.encode(outerPayload(mapper, token, params), StandardCharsets.UTF_8);
    }

    private static ArrayNode descriptor(ObjectMapper mapper) {
        ArrayNode client = mapper.createArrayNode();
        client.add("X").add("X");
        client.add(mapper.createArrayNode().add("X").add("X"));
        client.addNull().addNull();
        client.add(1).add(1);
        client.add(LOCALE);
        client.addNull();
        client.add(1);
        client.addNull().addNull().addNull().addNull().addNull();
        client.add(0).add(1);

        ArrayNode descriptor = mapper.createArrayNode();
        descriptor.add(client);
        descriptor.add("X").add("X");
        descriptor.add(1);
        descriptor.add(mapper.createArrayNode().add(1).add(1).add(1));
        descriptor.add(1).add(1);
        descriptor.addNull();
        descriptor.add(0).add(0);
        descriptor.addNull();
        descriptor.add(0);
        return descriptor;
    }
}
