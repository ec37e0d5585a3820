package com.toolhub.tool.echo;

import com.toolhub.tools.ExecutionContext;
import com.toolhub.tools.Tool;
import com.toolhub.tools.spec.ToolSpec;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EchoToolProviderTest {

    private final EchoToolProvider provider = new EchoToolProvider();

    @Test
    void echoesTextUnchanged() throws Exception {
        Tool tool = provider.createFactory().create(ToolSpec.builder("Echo", EchoToolProvider.TYPE_ID).build());

        assertEquals("hi", tool.execute(Map.of("text", "hi"), ExecutionContext.unbounded("Echo")));
        assertEquals("  spaced  ", tool.execute(Map.of("text", "  spaced  "), ExecutionContext.unbounded("Echo")));
    }

    @Test
    void prefixSettingIsPrepended() throws Exception {
        ToolSpec spec = ToolSpec.builder("LoudEcho", EchoToolProvider.TYPE_ID).setting("prefix", "ECHO: ").build();

        Tool tool = provider.createFactory().create(spec);

        assertEquals("ECHO: hello", tool.execute(Map.of("text", "hello"), ExecutionContext.unbounded("LoudEcho")));
    }

    @Test
    void typeIdMatchesCatalogType() {
        assertEquals("EchoTool", provider.getTypeId());
    }
}
