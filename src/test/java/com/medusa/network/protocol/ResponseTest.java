package com.medusa.network.protocol;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ResponseTest {

    @Test
    void encode_singleLineStatuses() {
        assertThat(Response.ok("done").encode()).isEqualTo("OK: done\n");
        assertThat(Response.notFound("Key 'k' not found").encode()).isEqualTo("NULL: Key 'k' not found\n");
        assertThat(Response.bool(true, "yes").encode()).isEqualTo("TRUE: yes\n");
        assertThat(Response.bool(false, "no").encode()).isEqualTo("FALSE: no\n");
        assertThat(Response.error("bad").encode()).isEqualTo("ERROR: bad\n");
    }

    @Test
    void encode_pongHasNoMessage() {
        assertThat(Response.pong().encode()).isEqualTo("PONG\n");
    }

    @Test
    void encode_multilineEndsWithEmptyLine() {
        Response response = Response.okMultiline("Server info", "# Server\nmedusa_version:0.1.0");

        assertThat(response.isMultiline()).isTrue();
        assertThat(response.encode()).isEqualTo("OK: Server info\n# Server\nmedusa_version:0.1.0\n\n");
    }

    @Test
    void goodbye_closesConnection() {
        assertThat(Response.goodbye().shouldClose()).isTrue();
        assertThat(Response.goodbye().encode()).isEqualTo("OK: Goodbye!\n");
        assertThat(Response.ok("x").shouldClose()).isFalse();
    }

    @Test
    void isError_onlyForErrorStatus() {
        assertThat(Response.error("x").isError()).isTrue();
        assertThat(Response.notFound("x").isError()).isFalse();
    }

    @Test
    void equals_comparesContent() {
        assertThat(Response.ok("a")).isEqualTo(Response.ok("a"));
        assertThat(Response.ok("a")).isNotEqualTo(Response.notFound("a"));
        assertThat(Response.ok("a").hashCode()).isEqualTo(Response.ok("a").hashCode());
    }
}
