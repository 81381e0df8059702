package com.x4.projector.definition;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.x4.projector.definition.exception.MalformedDefinitionException;
import com.x4.projector.definition.model.ConnectionRef;
import com.x4.projector.definition.model.DefinitionNode;
import com.x4.projector.definition.model.NodeOrigin;

/**
 * Unit tests for DefinitionDocumentParser.
 */
class DefinitionDocumentParserTest {

    private final DefinitionDocumentParser parser = new DefinitionDocumentParser();

    @Test
    void testParseMacro() {
        List<DefinitionNode> nodes = parse("""
                <macros>
                  <macro name="ship_arg_s_fighter_01_a_macro" class="ship_s" extends="ship_base_macro">
                    <component ref="ship_arg_s_fighter_01" />
                    <properties>
                      <identification name="{20101,10101}" makerrace="argon" />
                      <hull max="3000" />
                      <physics mass="10.5">
                        <drag forward="1.2" reverse="4.8" />
                      </physics>
                    </properties>
                    <connections>
                      <connection ref="con_engine_01">
                        <macro ref="engine_arg_s_allround_01_mk1_macro" connection="ShipConnection" />
                      </connection>
                      <connection ref="con_engine_02">
                        <macro ref="engine_arg_s_allround_01_mk1_macro" connection="ShipConnection" />
                      </connection>
                      <connection ref="con_empty" />
                    </connections>
                  </macro>
                </macros>
                """);

        assertThat(nodes).hasSize(1);
        DefinitionNode ship = nodes.get(0);
        assertThat(ship.getId()).isEqualTo("ship_arg_s_fighter_01_a_macro");
        assertThat(ship.getKind()).isEqualTo("ship_s");
        assertThat(ship.getOrigin()).isEqualTo(NodeOrigin.MACRO);
        assertThat(ship.getExtendsId()).contains("ship_base_macro");
        assertThat(ship.getComponentRef()).contains("ship_arg_s_fighter_01");
        assertThat(ship.getProperties()).containsOnly(
                Map.entry("identification.name", "{20101,10101}"),
                Map.entry("identification.makerrace", "argon"),
                Map.entry("hull.max", "3000"),
                Map.entry("physics.mass", "10.5"),
                Map.entry("physics.drag.forward", "1.2"),
                Map.entry("physics.drag.reverse", "4.8"));
        assertThat(ship.getConnections())
                .extracting(ConnectionRef::getRole)
                .containsExactly("con_engine_01", "con_engine_02");
        assertThat(ship.getConnections().get(0).getTargetId()).contains("engine_arg_s_allround_01_mk1_macro");
        assertThat(ship.getSourcePath()).isEqualTo("test.xml");
    }

    @Test
    void testParseComponentConnectionPoints() {
        List<DefinitionNode> nodes = parse("""
                <components>
                  <component name="engine_arg_s_allround_01" class=" engine ">
                    <connections>
                      <connection name="con_engine" tags="engine small" />
                      <connection name="con_anim" />
                    </connections>
                  </component>
                </components>
                """);

        DefinitionNode component = nodes.get(0);
        assertThat(component.getOrigin()).isEqualTo(NodeOrigin.COMPONENT);
        assertThat(component.getKind()).isEqualTo("engine");
        assertThat(component.getConnections()).hasSize(2);
        ConnectionRef mount = component.getConnections().get(0);
        assertThat(mount.getTargetId()).isEmpty();
        assertThat(mount.hasTag("small")).isTrue();
        assertThat(mount.hasTag("smal")).isFalse();
        assertThat(component.getConnections().get(1).getTags()).isEmpty();
    }

    @Test
    void testParseWares() {
        List<DefinitionNode> nodes = parse("""
                <wares>
                  <ware id="energycells" name="{20201,701}" volume="6" tags="container economy">
                    <price min="10" average="16" max="22" />
                    <production time="60" amount="175" method="default">
                      <primary>
                        <ware ware="sunlight" amount="2" />
                      </primary>
                    </production>
                    <owner faction="argon" />
                    <restriction licence="ceremonyfriend" />
                  </ware>
                </wares>
                """);

        DefinitionNode ware = nodes.get(0);
        assertThat(ware.getOrigin()).isEqualTo(NodeOrigin.WARE);
        assertThat(ware.getKind()).isEqualTo(DefinitionDocumentParser.WARE_KIND);
        assertThat(ware.getProperties())
                .containsEntry("name", "{20201,701}")
                .containsEntry("price.average", "16")
                .doesNotContainKey("id");
        assertThat(ware.getEntries().get("production")).singleElement()
                .satisfies(production -> assertThat(production)
                        .containsEntry("time", "60")
                        .containsEntry("primary.sunlight", "2"));
        assertThat(ware.getEntries().get("owner")).containsExactly(Map.of("faction", "argon"));
        assertThat(ware.getEntries().get("restriction")).containsExactly(Map.of("licence", "ceremonyfriend"));
    }

    @Test
    void testRepeatedPropertyKeepsFirstValue() {
        List<DefinitionNode> nodes = parse("""
                <macros>
                  <macro name="m" class="engine">
                    <properties>
                      <thrust forward="100" />
                      <thrust forward="200" />
                    </properties>
                  </macro>
                </macros>
                """);

        assertThat(nodes.get(0).property("thrust.forward")).contains("100");
    }

    @Test
    void testMissingClassIsMalformed() {
        assertThatThrownBy(() -> parse("<macros><macro name=\"m\"/></macros>"))
                .isInstanceOf(MalformedDefinitionException.class)
                .hasMessageContaining("test.xml")
                .hasMessageContaining("'class'");
    }

    @Test
    void testDuplicateIdentifierIsMalformed() {
        assertThatThrownBy(() -> parse("""
                <macros>
                  <macro name="m" class="engine" />
                  <macro name="m" class="engine" />
                </macros>
                """))
                .isInstanceOf(MalformedDefinitionException.class)
                .hasMessageContaining("duplicate identifier m");
    }

    @Test
    void testBrokenMarkupIsMalformed() {
        assertThatThrownBy(() -> parse("<macros><macro name=\"m\" class=\"engine\"></macros>"))
                .isInstanceOf(MalformedDefinitionException.class)
                .satisfies(e -> assertThat(((MalformedDefinitionException) e).getSourcePath()).isEqualTo("test.xml"));
    }

    @Test
    void testUnexpectedRootIsMalformed() {
        assertThatThrownBy(() -> parse("<diff/>"))
                .isInstanceOf(MalformedDefinitionException.class)
                .hasMessageContaining("<diff>");
    }

    private List<DefinitionNode> parse(String xml) {
        return parser.parse(xml.getBytes(StandardCharsets.UTF_8), "test.xml");
    }
}
