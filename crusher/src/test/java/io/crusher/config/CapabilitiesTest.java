package io.crusher.config;

import io.crusher.core.ContentType;
import io.crusher.core.Crusher;
import io.crusher.registry.CrusherRegistry;
import io.crusher.transform.ClosureCrusher;
import io.crusher.transform.YuiCrusher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class CapabilitiesTest {
    @TempDir
    Path dir;

    @Test
    void default_config_finds_java_and_the_vendor_jars_on_the_class_path() {
        Capabilities caps = Capabilities.probe(CrusherConfig.defaults());
        assertTrue(caps.java().isPresent(), caps.toString());
        Path yui = caps.jar(Capabilities.YUI_JAR).orElseThrow();
        Path closure = caps.jar(Capabilities.CLOSURE_JAR).orElseThrow();
        assertTrue(Files.isRegularFile(yui));
        assertTrue(yui.getFileName().toString().startsWith("yuicompressor"), yui.toString());
        assertTrue(closure.getFileName().toString().startsWith("closure-compiler"), closure.toString());
    }

    @Test
    void default_config_runs_yui_locally() throws Exception {
        CrusherConfig config = CrusherConfig.defaults();
        CrusherRegistry registry = CrusherRegistry.standard(config, Capabilities.probe(config));

        Crusher yui = registry.lookup("yui", ContentType.JS).orElseThrow();
        assertTrue(((YuiCrusher) yui).runsLocally());
        String js = yui.crush(ContentType.JS, "var  a = 1 ;").toCompletableFuture().get();
        assertEquals("var a=1;", js.trim());
        String css = yui.crush(ContentType.CSS, "a { color: red; }").toCompletableFuture().get();
        assertEquals("a{color:red}", css.trim());

        assertTrue(((ClosureCrusher) registry.lookup("closure", ContentType.JS).orElseThrow()).runsLocally());
    }

    @Test
    void vendor_directory_jar_wins_over_the_class_path() throws Exception {
        Path jar = Files.createFile(dir.resolve(Capabilities.YUI_JAR));
        CrusherConfig config = new CrusherConfig(1, CrusherConfig.WorkerMode.THREAD, dir, null,
                CrusherConfig.DEFAULT_CLOSURE_URL, 0, Duration.ofSeconds(1));
        Capabilities caps = Capabilities.probe(config);
        assertEquals(jar, caps.jar(Capabilities.YUI_JAR).orElseThrow());
        assertNotEquals(dir, caps.jar(Capabilities.CLOSURE_JAR).orElseThrow().getParent());
    }

    @Test
    void classes_outside_a_jar_are_not_vendor_jars() {
        // test classes load from a directory
        assertTrue(Capabilities.classpathJar(CapabilitiesTest.class.getName()).isEmpty());
        assertTrue(Capabilities.classpathJar("com.example.Missing").isEmpty());
    }

    @Test
    void without_a_jar_java_alone_does_not_run_locally() {
        Capabilities caps = Capabilities.withJava(Path.of("/usr/bin/java"));
        CrusherRegistry registry = CrusherRegistry.standard(CrusherConfig.defaults(), caps);
        assertFalse(((YuiCrusher) registry.lookup("yui", ContentType.CSS).orElseThrow()).runsLocally());

        Capabilities withJar = caps.withJar(Capabilities.YUI_JAR, dir.resolve("yui.jar"));
        assertEquals(dir.resolve("yui.jar"), withJar.jar(Capabilities.YUI_JAR).orElseThrow());
        assertTrue(caps.jar(Capabilities.YUI_JAR).isEmpty());
    }
}
