package com.deepansh.coderflow.tool.gateway;

import com.deepansh.coderflow.config.ToolProperties;
import com.deepansh.coderflow.exception.AgentException;
import com.deepansh.coderflow.tool.AgentTool;
import com.deepansh.coderflow.tool.ToolInvocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GatewayToolProviderTest {

    @Mock
    private ToolGatewayClient client;

    private final Executor direct = Runnable::run;
    private ToolProperties props;

    @BeforeEach
    void setUp() {
        props = new ToolProperties();
        props.getGateway().setEnabled(true);
    }

    @Test
    void disabledGateway_loadsNothing() {
        props.getGateway().setEnabled(false);

        List<AgentTool> tools = new GatewayToolProvider(props, client, direct).loadTools();

        assertThat(tools).isEmpty();
        verifyNoInteractions(client);
    }

    @Test
    void listedTools_areRegisteredOnceAndNamelessOnesSkipped() {
        when(client.listTools()).thenReturn(List.of(
                Map.of("name", "search_files", "description", "Find files",
                        "inputSchema", Map.of("type", "object", "properties", Map.of("pattern", Map.of("type", "string")))),
                Map.of("name", "search_files", "description", "duplicate"),
                Map.of("description", "no name"),
                Map.of("name", "git_status")));

        List<AgentTool> tools = new GatewayToolProvider(props, client, direct).loadTools();

        assertThat(tools).extracting(AgentTool::getName).containsExactly("search_files", "git_status");
        assertThat(tools.get(0).getDescription()).isEqualTo("Find files");
        assertThat(tools.get(1).getInputSchema()).containsEntry("properties", Map.of());
    }

    @Test
    void unreachableGateway_failsStartup() {
        when(client.listTools()).thenThrow(new ResourceAccessException("Connection refused"));

        assertThatThrownBy(() -> new GatewayToolProvider(props, client, direct).loadTools())
                .isInstanceOf(AgentException.class)
                .hasMessageContaining("unreachable");
    }

    @Test
    void gatewayTool_forwardsArguments() {
        when(client.listTools()).thenReturn(List.of(Map.of("name", "search_files",
                "inputSchema", Map.of("type", "object", "properties", Map.of("pattern", Map.of("type", "string"))))));
        when(client.callTool(eq("search_files"), anyMap())).thenReturn("a.py\nb.py");

        AgentTool tool = new GatewayToolProvider(props, client, direct).loadTools().get(0);
        Object result = tool.execute(new ToolInvocation("c1", Map.of("pattern", "*.py"))).join();

        assertThat(result).isEqualTo("a.py\nb.py");
        verify(client).callTool("search_files", Map.of("pattern", "*.py"));
    }

    @Test
    void parameterlessGatewayTool_isCalledWithoutArguments() {
        when(client.listTools()).thenReturn(List.of(Map.of("name", "git_status")));
        when(client.callTool(eq("git_status"), anyMap())).thenReturn("clean");

        AgentTool tool = new GatewayToolProvider(props, client, direct).loadTools().get(0);
        tool.execute(new ToolInvocation("c1", Map.of("query", "stray"))).join();

        verify(client).callTool("git_status", Map.of());
    }
}
