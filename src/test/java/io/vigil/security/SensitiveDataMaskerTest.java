package io.vigil.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vigil.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysAndTokenLikeValues() {
        ObjectNode input = Jsons.mapper().createObjectNode();
        input.put("password", "hunter2");
        input.putObject("headers").put("Authorization", "Bearer x");
        input.put("opaque", "AbCdEfGhIjKlMnOpQrStUvWxYz0123456789abcdEF");
        input.put("note", "build failed on step compile");

        JsonNode out = SensitiveDataMasker.masked(input);
        Assertions.assertEquals("***", out.path("password").asText());
        Assertions.assertEquals("***", out.path("headers").path("Authorization").asText());
        Assertions.assertEquals("***", out.path("opaque").asText());
        Assertions.assertEquals("build failed on step compile", out.path("note").asText());
    }

    @Test
    void supervisorIdentifiersAreNotMasked() {
        ObjectNode input = Jsons.mapper().createObjectNode();
        input.put("instance", "ins_3f1c2a7e-9b4d-4c1e-8f7a-0d2b6e5c9a11");
        input.put("execution", "exe_7a9e1d3c-2b5f-4e8a-9c1d-6f0b3a2e8d44");

        JsonNode out = SensitiveDataMasker.masked(input);
        Assertions.assertEquals(input.path("instance").asText(), out.path("instance").asText());
        Assertions.assertEquals(input.path("execution").asText(), out.path("execution").asText());
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey("task_id"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("session_cookie"));
    }
}
