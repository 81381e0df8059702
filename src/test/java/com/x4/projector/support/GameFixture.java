package com.x4.projector.support;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tiny game installation: one ship with an engine, a storage module and a
 * missing shield, a two step engine family, a shield, two wares and the English
 * texts. Layer 2 patches the mk1 engine's forward thrust from 90 to 100.
 */
public final class GameFixture {

    public static final String MK1_ENGINE = "engine_gen_m_allround_01_mk1_macro";
    public static final String MK2_ENGINE = "engine_gen_m_allround_01_mk2_macro";
    public static final String BASE_ENGINE = "generic_engine_base_macro";
    public static final String SHIP = "ship_gen_s_fighter_01_a_macro";
    public static final String STORAGE = "storage_gen_s_container_01_macro";
    public static final String SHIELD = "shield_gen_s_standard_01_mk1_macro";
    public static final String MISSING_SHIELD = "shield_gen_s_missing_01_mk1_macro";

    static final String MK1_ENGINE_PATH = "assets/props/Engines/macros/" + MK1_ENGINE + ".xml";

    private GameFixture() {
    }

    public static Map<String, String> baseFiles() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("index/macros.xml", """
                <?xml version="1.0" encoding="utf-8"?>
                <index>
                  <entry name="engine_gen_m_allround_01_mk1_macro" value="assets\\props\\Engines\\macros\\engine_gen_m_allround_01_mk1_macro"/>
                  <entry name="engine_gen_m_allround_01_mk2_macro" value="assets\\props\\Engines\\macros\\engine_gen_m_allround_01_mk2_macro"/>
                  <entry name="generic_engine_base_macro" value="assets\\props\\Engines\\templates\\generic_engine_base_macro"/>
                  <entry name="storage_gen_s_container_01_macro" value="assets\\props\\StorageModules\\macros\\storage_gen_s_container_01_macro"/>
                  <entry name="shield_gen_s_standard_01_mk1_macro" value="assets\\props\\SurfaceElements\\macros\\shield_gen_s_standard_01_mk1_macro"/>
                  <entry name="ship_gen_s_fighter_01_a_macro" value="assets\\units\\size_s\\macros\\ship_gen_s_fighter_01_a_macro"/>
                </index>
                """);
        files.put("index/components.xml", """
                <?xml version="1.0" encoding="utf-8"?>
                <index>
                  <entry name="engine_gen_m_allround_01_mk1" value="assets\\props\\Engines\\engine_gen_m_allround_01_mk1"/>
                  <entry name="ship_gen_s_fighter_01" value="assets\\units\\size_s\\ship_gen_s_fighter_01"/>
                </index>
                """);
        files.put("assets/props/Engines/templates/generic_engine_base_macro.xml", """
                <?xml version="1.0" encoding="utf-8"?>
                <macros>
                  <macro name="generic_engine_base_macro" class="engine">
                    <properties>
                      <boost duration="10" />
                      <hull max="500" />
                    </properties>
                  </macro>
                </macros>
                """);
        files.put(MK1_ENGINE_PATH, engine(MK1_ENGINE, "90"));
        files.put("assets/props/Engines/macros/" + MK2_ENGINE + ".xml", """
                <?xml version="1.0" encoding="utf-8"?>
                <macros>
                  <macro name="engine_gen_m_allround_01_mk2_macro" class="engine" extends="engine_gen_m_allround_01_mk1_macro">
                    <properties>
                      <identification name="{20107,1034}" />
                      <thrust forward="150" />
                    </properties>
                  </macro>
                </macros>
                """);
        files.put("assets/props/Engines/engine_gen_m_allround_01_mk1.xml", """
                <?xml version="1.0" encoding="utf-8"?>
                <components>
                  <component name="engine_gen_m_allround_01_mk1" class="engine">
                    <connections>
                      <connection name="connection_engine" tags="engine medium" />
                    </connections>
                  </component>
                </components>
                """);
        files.put("assets/props/SurfaceElements/macros/" + SHIELD + ".xml", """
                <?xml version="1.0" encoding="utf-8"?>
                <macros>
                  <macro name="shield_gen_s_standard_01_mk1_macro" class="shieldgenerator">
                    <properties>
                      <identification name="Standard Shield" makerrace="argon" />
                      <recharge max="500" rate="50" delay="0.5" />
                    </properties>
                  </macro>
                </macros>
                """);
        files.put("assets/props/StorageModules/macros/" + STORAGE + ".xml", """
                <?xml version="1.0" encoding="utf-8"?>
                <macros>
                  <macro name="storage_gen_s_container_01_macro" class="storage">
                    <properties>
                      <cargo max="500" tags="container" />
                    </properties>
                  </macro>
                </macros>
                """);
        files.put("assets/units/size_s/macros/" + SHIP + ".xml", """
                <?xml version="1.0" encoding="utf-8"?>
                <macros>
                  <macro name="ship_gen_s_fighter_01_a_macro" class="ship_s">
                    <component ref="ship_gen_s_fighter_01" />
                    <properties>
                      <identification name="{20101,1}" makerrace="argon" />
                      <hull max="3000" />
                      <purpose primary="fight" />
                      <ship type="fighter" />
                      <people capacity="1" />
                      <physics mass="10.5" />
                    </properties>
                    <connections>
                      <connection ref="con_engine_01">
                        <macro ref="engine_gen_m_allround_01_mk1_macro" connection="ShipConnection" />
                      </connection>
                      <connection ref="con_storage01">
                        <macro ref="storage_gen_s_container_01_macro" connection="ShipConnection" />
                      </connection>
                      <connection ref="con_shield_01">
                        <macro ref="shield_gen_s_missing_01_mk1_macro" connection="ShipConnection" />
                      </connection>
                    </connections>
                  </macro>
                </macros>
                """);
        files.put("assets/units/size_s/ship_gen_s_fighter_01.xml", """
                <?xml version="1.0" encoding="utf-8"?>
                <components>
                  <component name="ship_gen_s_fighter_01" class="ship_s">
                    <connections>
                      <connection name="con_engine_01" tags="engine small" />
                      <connection name="con_shield_01" tags="shield small" />
                      <connection name="con_weapon_01" tags="weapon small" />
                      <connection name="con_weapon_02" tags="weapon small" />
                    </connections>
                  </component>
                </components>
                """);
        files.put("libraries/wares.xml", """
                <?xml version="1.0" encoding="utf-8"?>
                <wares>
                  <ware id="energycells" name="{20201,701}" description="{20201,702}" group="energy" transport="container" volume="6" tags="container economy">
                    <price min="10" average="16" max="22" />
                    <production time="60" amount="175" method="default" name="{20206,101}">
                      <primary>
                        <ware ware="sunlight" amount="2" />
                      </primary>
                    </production>
                    <owner faction="argon" />
                    <owner faction="teladi" />
                  </ware>
                  <ware id="engine_gen_m_allround_01_mk1" name="{20107,1024}" group="engines" transport="equipment" volume="1" tags="engine equipment">
                    <price min="100" average="120" max="140" />
                    <restriction licence="generaluseequipment" />
                  </ware>
                </wares>
                """);
        files.put("t/0001-l044.xml", """
                <?xml version="1.0" encoding="utf-8"?>
                <language id="44">
                  <page id="20101">
                    <t id="1">Fighter</t>
                  </page>
                  <page id="20107">
                    <t id="1024">{20107,1025} Engine Mk1</t>
                    <t id="1025">Allround</t>
                    <t id="1034">Allround Engine Mk2 (internal note)</t>
                  </page>
                  <page id="20201">
                    <t id="701">Energy Cells</t>
                    <t id="702">Stored energy</t>
                  </page>
                  <page id="20206">
                    <t id="101">Solar Plant</t>
                  </page>
                </language>
                """);
        return files;
    }

    /**
     * Files of the second archive layer.
     */
    public static Map<String, String> patchFiles() {
        return Map.of(MK1_ENGINE_PATH, engine(MK1_ENGINE, "100"));
    }

    /**
     * Writes {@code 01.cat/01.dat} with the base files and {@code 02.cat/02.dat}
     * with the patch.
     */
    public static void writeArchives(Path gameRoot) throws IOException {
        ArchiveFixture.layer(gameRoot, 1).files(baseFiles()).write();
        ArchiveFixture.layer(gameRoot, 2).files(patchFiles()).write();
    }

    /**
     * Writes the patched file tree as plain files.
     */
    public static void writeExtracted(Path gameRoot) throws IOException {
        Map<String, String> files = new LinkedHashMap<>(baseFiles());
        files.putAll(patchFiles());
        for (Map.Entry<String, String> file : files.entrySet()) {
            Path target = gameRoot.resolve(file.getKey());
            Files.createDirectories(target.getParent());
            Files.writeString(target, file.getValue());
        }
    }

    private static String engine(String name, String forwardThrust) {
        return """
                <?xml version="1.0" encoding="utf-8"?>
                <macros>
                  <macro name="%s" class="engine" extends="generic_engine_base_macro">
                    <component ref="engine_gen_m_allround_01_mk1" />
                    <properties>
                      <identification name="{20107,1024}" makerrace="argon" />
                      <thrust forward="%s" reverse="80" />
                      <boost thrust="8" />
                      <travel thrust="12" />
                    </properties>
                  </macro>
                </macros>
                """.formatted(name, forwardThrust);
    }
}
