package com.toolflow.worker;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ToolRegistryTest {

    @Test
    void register_shouldMakeHandlerFindable() throws Exception {
        ToolRegistry registry = new ToolRegistry()
            .register("echo", (args, context, hooks) -> args);

        assertThat(registry.contains("echo")).isTrue();
        assertThat(registry.find("echo")).isPresent();
        assertThat(registry.find("echo").get().execute(TextNode.valueOf("hi"), null, ToolHooks.none()))
            .isEqualTo(TextNode.valueOf("hi"));
    }

    @Test
    void register_sameName_shouldReplace() throws Exception {
        ToolRegistry registry = new ToolRegistry()
            .register("scan", (args, context, hooks) -> TextNode.valueOf("v1"))
            .register("scan", (args, context, hooks) -> TextNode.valueOf("v2"));

        assertThat(registry.find("scan").get().execute(null, null, ToolHooks.none()).asText()).isEqualTo("v2");
        assertThat(registry.toolNames()).containsExactly("scan");
    }

    @Test
    void register_blankName_shouldBeRejected() {
        assertThatThrownBy(() -> new ToolRegistry().register(" ", (args, context, hooks) -> null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void find_unknown_shouldBeEmpty() {
        assertThat(new ToolRegistry().find("missing")).isEmpty();
    }

    @Test
    void toolNames_shouldBeSorted() {
        ToolRegistry registry = new ToolRegistry()
            .register("ssh_exec", (args, context, hooks) -> null)
            .register("apply_patch", (args, context, hooks) -> null)
            .register("git_status", (args, context, hooks) -> null);

        assertThat(registry.toolNames()).containsExactly("apply_patch", "git_status", "ssh_exec");
    }
}
