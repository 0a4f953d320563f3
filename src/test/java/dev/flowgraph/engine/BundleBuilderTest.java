package dev.flowgraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.flowgraph.model.ComponentPin;
import dev.flowgraph.model.FlowBundle;
import dev.flowgraph.model.FlowDocument;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BundleBuilderTest {

    private static final String FLOW = """
        id: bundle-me
        type: messaging
        start: a
        nodes:
          a:
            ai.greentic.echo.process:
              message: hi
              level: 2
            routing:
              - to: b
          b:
            ai.greentic.echo.other: {}
            routing:
              - to: c
          c:
            questions:
              fields:
                - id: name
            routing:
              - to: d
          d:
            qa.process: {}
            routing: out
        """;

    private static final String FLOW_REORDERED = """
        nodes:
          d:
            routing: out
            qa.process: {}
          c:
            routing:
              - to: d
            questions:
              fields:
                - id: name
          b:
            routing:
              - to: c
            ai.greentic.echo.other: {}
          a:
            routing:
              - to: b
            ai.greentic.echo.process:
              level: 2
              message: hi
        start: a
        type: messaging
        id: bundle-me
        """;

    @Test
    void hashIgnoresKeyOrder() {
        FlowBundle first = BundleBuilder.build(TestFlows.load(FLOW));
        FlowBundle second = BundleBuilder.build(TestFlows.load(FLOW_REORDERED));

        assertThat(second.hash()).isEqualTo(first.hash());
        assertThat(first.hash()).hasSize(64).matches("[0-9a-f]+");
    }

    private static final String ONE_NODE = """
        id: single
        type: messaging
        start: a
        nodes:
          a:
            qa.process: {}
        """;

    @Test
    void hashIgnoresRoutingShorthand() {
        FlowBundle shorthand = BundleBuilder.build(TestFlows.load(ONE_NODE + "    routing: out\n"));
        FlowBundle list = BundleBuilder.build(TestFlows.load(ONE_NODE + """
                routing:
                  - out: true
            """));

        assertThat(list.hash()).isEqualTo(shorthand.hash());
        assertThat(list.canonicalJson().at("/nodes/a/routing").asText()).isEqualTo("out");
    }

    @Test
    void hashTreatsEmptyRoutingListAsAbsent() {
        FlowBundle absent = BundleBuilder.build(TestFlows.load(ONE_NODE));
        FlowBundle empty = BundleBuilder.build(TestFlows.load(ONE_NODE + "    routing: []\n"));

        assertThat(empty.hash()).isEqualTo(absent.hash());
        assertThat(empty.canonicalJson().at("/nodes/a").has("routing")).isFalse();
    }

    @Test
    void hashIgnoresKindSpelling() {
        FlowBundle withType = BundleBuilder.build(TestFlows.load(ONE_NODE));
        FlowBundle withKind = BundleBuilder.build(TestFlows.load(ONE_NODE.replace("type: messaging", "kind: messaging")));

        assertThat(withKind.hash()).isEqualTo(withType.hash());
    }

    @Test
    void hashChangesWithRoutingTarget() {
        String twoNodes = ONE_NODE + """
                routing:
                  - to: b
              b:
                qa.process: {}
            """;
        FlowBundle routed = BundleBuilder.build(TestFlows.load(twoNodes));
        FlowBundle terminal = BundleBuilder.build(TestFlows.load(twoNodes.replace("- to: b", "- out: true")));

        assertThat(terminal.hash()).isNotEqualTo(routed.hash());
    }

    @Test
    void hashChangesWithPayload() {
        FlowBundle first = BundleBuilder.build(TestFlows.load(FLOW));
        FlowBundle changed = BundleBuilder.build(TestFlows.load(FLOW.replace("message: hi", "message: bye")));

        assertThat(changed.hash()).isNotEqualTo(first.hash());
    }

    @Test
    void pinsOneEntryPerComponentSkippingBuiltins() {
        FlowBundle bundle = BundleBuilder.build(TestFlows.load(FLOW));

        assertThat(bundle.componentPins()).containsExactly(
            new ComponentPin("ai", "greentic", ComponentPin.ANY_VERSION),
            new ComponentPin("qa", "process", ComponentPin.ANY_VERSION)
        );
    }

    @Test
    void explicitPinsOverrideWildcard() {
        FlowBundle bundle = BundleBuilder.build(TestFlows.load(FLOW), Map.of("qa.process", "^1.2"));

        assertThat(bundle.componentPins()).containsExactly(
            new ComponentPin("ai", "greentic", "*"),
            new ComponentPin("qa", "process", "^1.2")
        );
    }

    @Test
    void entryFollowsStartThenInThenFirst() {
        assertThat(BundleBuilder.build(TestFlows.load(FLOW)).entry()).isEqualTo("a");

        FlowDocument withIn = TestFlows.load("""
            id: f
            type: messaging
            nodes:
              other:
                qa.process: {}
              in:
                qa.process: {}
            """);
        assertThat(BundleBuilder.build(withIn).entry()).isEqualTo("in");

        FlowDocument firstOnly = FlowDocument.of("f", "messaging", null,
            TestFlows.load(FLOW).nodes());
        assertThat(BundleBuilder.build(firstOnly).entry()).isEqualTo("a");
    }

    @Test
    void rendersWireShape() {
        FlowBundle bundle = BundleBuilder.build(TestFlows.load(FLOW));

        JsonNode json = BundleBuilder.toJson(bundle);

        assertThat(json.get("id").asText()).isEqualTo("bundle-me");
        assertThat(json.get("entry").asText()).isEqualTo("a");
        assertThat(json.get("hash").asText()).isEqualTo(bundle.hash());
        assertThat(json.get("component_pins")).hasSize(2);
        assertThat(json.get("component_pins").get(0).get("version_constraint").asText()).isEqualTo("*");
        assertThat(bundle.canonicalJson().get("nodes").fieldNames().next()).isEqualTo("a");
    }
}
