package com.openforge.mcpgateway.mcp;

import com.openforge.mcpgateway.conversation.ToolSpec;
import com.openforge.mcpgateway.support.FakeToolProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ToolCatalogTest {

    @Test
    void flattensProvidersInOrder() {
        FakeToolProvider files = new FakeToolProvider("files").tool("read", args -> "").tool("write", args -> "");
        FakeToolProvider web   = new FakeToolProvider("web").tool("fetch", args -> "");

        ToolCatalog catalog = ToolCatalog.build(List.of(files, web));

        assertThat(catalog.specs()).extracting(ToolSpec::name).containsExactly("read", "write", "fetch");
        assertThat(catalog.providerOf("fetch")).containsSame(web);
        assertThat(catalog.providerOf("missing")).isEmpty();
    }

    @Test
    void laterProviderWinsADuplicateName() {
        FakeToolProvider first  = new FakeToolProvider("first").tool("search", args -> "first");
        FakeToolProvider second = new FakeToolProvider("second").tool("search", args -> "second");

        ToolCatalog catalog = ToolCatalog.build(List.of(first, second));

        assertThat(catalog.size()).isEqualTo(1);
        assertThat(catalog.specs()).singleElement()
                .satisfies(spec -> assertThat(spec.description()).isEqualTo("second search"));
        assertThat(catalog.providerOf("search")).containsSame(second);
    }

    @Test
    void emptyCatalogHasNoTools() {
        assertThat(ToolCatalog.empty().specs()).isEmpty();
        assertThat(ToolCatalog.build(List.of()).size()).isZero();
    }
}
