package com.newsresolver.integration.googlenews;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsresolver.domain.dto.SignedParams;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class BatchExecuteEnvelopeTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SignedParams params = new SignedParams("AZ5r3eTsig", 1736712345L);

    @Test
    void innerPayload_matchesWireFormatExactly() throws Exception {
        String inner = BatchExecuteEnvelope.innerPayload(mapper, "CBMiTOKEN", params);

        assertThat(inner).isEqualTo(
                "[\"garturlreq\",[[\"X\",\"X\",[\"X\",\"X\"],null,null,1,1,\"US:en\",null,1,null,null,null,null,null,0,1],"
                        + "\"X\",\"X\",1,[1,1,1],1,1,null,0,0,null,0],"
                        + "\"CBMiTOKEN\",1736712345,\"AZ5r3eTsig\"]");
    }

    @Test
    void outerPayload_wrapsInnerAsStringUnderRpcId() throws Exception {
        String outer = BatchExecuteEnvelope.outerPayload(mapper, "CBMiTOKEN", params);

        JsonNode root = mapper.readTree(outer);
        assertThat(root.size()).isEqualTo(1);
        assertThat(root.get(0).size()).isEqualTo(1);

        JsonNode call = root.get(0).get(0);
        assertThat(call.get(0).asText()).isEqualTo("Fbv4je");
        assertThat(call.get(1).isTextual()).isTrue();
        assertThat(call.get(1).asText()).isEqualTo(BatchExecuteEnvelope.innerPayload(mapper, "CBMiTOKEN", params));
    }

    @Test
    void formBody_isSingleUrlEncodedField() throws Exception {
        String body = BatchExecuteEnvelope.formBody(mapper, "CBMiTOKEN", params);

        assertThat(body).startsWith("f.req=");
        assertThat(body.substring("f.req=".length())).doesNotContain("[", "\"", " ");

        String decoded = URLDecoder.decode(body.substring("f.req=".length()), StandardCharsets.UTF_8);
        assertThat(decoded).isEqualTo(BatchExecuteEnvelope.outerPayload(mapper, "CBMiTOKEN", params));
    }
}
