package dev.flowgraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowgraph.model.Diagnostic;
import dev.flowgraph.model.Route;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutingCodecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void expandsShorthandToSingleTerminalRoute() throws Exception {
        assertThat(RoutingCodec.parse(MAPPER.readTree("\"out\""))).containsExactly(Route.outRoute());
        assertThat(RoutingCodec.parse(MAPPER.readTree("\"reply\""))).containsExactly(Route.replyRoute());
    }

    @Test
    void absentOrNullRoutingIsEmpty() throws Exception {
        assertThat(RoutingCodec.parse(null)).isEmpty();
        assertThat(RoutingCodec.parse(MAPPER.readTree("null"))).isEmpty();
    }

    @Test
    void parsesListInOrder() throws Exception {
        JsonNode routing = MAPPER.readTree("""
            [
              {"status": "ok", "to": "next"},
              {"reply": true},
              {"out": true, "status": "done"}
            ]
            """);

        assertThat(RoutingCodec.parse(routing)).containsExactly(
            Route.toNode("next").withStatus("ok"),
            Route.replyRoute(),
            Route.outRoute().withStatus("done")
        );
    }

    @Test
    void reportsEachMalformedEntry() throws Exception {
        JsonNode routing = MAPPER.readTree("""
            [
              {"to": "a", "when": "x"},
              {"status": "ok"},
              "next",
              {"to": ""}
            ]
            """);
        var errors = new ArrayList<Diagnostic>();

        List<Route> routes = RoutingCodec.read(routing, "/nodes/n/routing", errors);

        assertThat(routes).isEmpty();
        assertThat(errors).extracting(Diagnostic::pointer).containsExactly(
            "/nodes/n/routing/0/when",
            "/nodes/n/routing/1",
            "/nodes/n/routing/2",
            "/nodes/n/routing/3/to"
        );
    }

    @Test
    void parseRejectsUnknownShorthand() throws Exception {
        JsonNode routing = MAPPER.readTree("\"sideways\"");

        assertThatThrownBy(() -> RoutingCodec.parse(routing))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sideways");
    }

    @Test
    void rendersShorthandOnlyForLoneUnguardedTerminal() {
        assertThat(RoutingCodec.render(List.of(Route.outRoute())).asText()).isEqualTo("out");
        assertThat(RoutingCodec.render(List.of(Route.replyRoute())).asText()).isEqualTo("reply");
        assertThat(RoutingCodec.render(List.of())).isNull();

        JsonNode single = RoutingCodec.render(List.of(Route.toNode("b")));
        assertThat(single.isArray()).isTrue();
        assertThat(single.get(0).get("to").asText()).isEqualTo("b");

        JsonNode guarded = RoutingCodec.render(List.of(Route.outRoute().withStatus("done")));
        assertThat(guarded.isArray()).isTrue();
        assertThat(guarded.get(0).get("status").asText()).isEqualTo("done");
    }
}
