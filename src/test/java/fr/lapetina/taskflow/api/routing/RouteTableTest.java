package fr.lapetina.taskflow.api.routing;

import fr.lapetina.taskflow.domain.error.ErrorCode;
import fr.lapetina.taskflow.domain.error.StructuredError;
import fr.lapetina.taskflow.domain.model.ApiResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouteTableTest {

    private static final RouteHandler OK = (request, params) -> CompletableFuture.completedFuture(ApiResponse.ok(null));

    private RouteTable routes;

    @BeforeEach
    void setUp() {
        routes = new RouteTable()
                .add(Route.of("GET", "/api/v1/tasks", "general", OK))
                .add(Route.of("POST", "/api/v1/tasks", "general", OK))
                .add(Route.of("GET", "/api/v1/tasks/{id}", "general", OK))
                .add(Route.admin("POST", "/admin/circuit-breakers/{id}/reset", "sensitive", OK));
    }

    @Test
    @DisplayName("should match literal templates")
    void shouldMatchLiteral() {
        RouteMatch match = routes.resolve("post", "/api/v1/tasks");

        assertThat(match.route().name()).isEqualTo("POST /api/v1/tasks");
        assertThat(match.pathParams()).isEmpty();
    }

    @Test
    @DisplayName("should extract path parameters")
    void shouldExtractParams() {
        RouteMatch match = routes.resolve("GET", "/api/v1/tasks/42");

        assertThat(match.route().template()).isEqualTo("/api/v1/tasks/{id}");
        assertThat(match.pathParams()).isEqualTo(Map.of("id", "42"));
    }

    @Test
    @DisplayName("should ignore a trailing slash")
    void shouldIgnoreTrailingSlash() {
        assertThat(routes.resolve("GET", "/api/v1/tasks/").route().template()).isEqualTo("/api/v1/tasks");
    }

    @Test
    @DisplayName("should report METHOD_NOT_ALLOWED with the allowed methods")
    void shouldRejectWrongMethod() {
        assertThatThrownBy(() -> routes.resolve("DELETE", "/api/v1/tasks"))
                .isInstanceOfSatisfying(StructuredError.class, error -> {
                    assertThat(error.getCode()).isEqualTo(ErrorCode.METHOD_NOT_ALLOWED);
                    assertThat(error.getStatusCode()).isEqualTo(405);
                    assertThat(error.getContext()).containsEntry("allowed", List.of("GET", "POST"));
                });
    }

    @Test
    @DisplayName("should report NOT_FOUND for unknown paths")
    void shouldRejectUnknownPath() {
        assertThatThrownBy(() -> routes.resolve("GET", "/api/v1/projects"))
                .isInstanceOfSatisfying(StructuredError.class,
                        error -> assertThat(error.getCode()).isEqualTo(ErrorCode.NOT_FOUND));
    }

    @Test
    @DisplayName("should not match an empty parameter segment")
    void shouldRejectEmptyParam() {
        assertThatThrownBy(() -> routes.resolve("POST", "/admin/circuit-breakers//reset"))
                .isInstanceOf(StructuredError.class);
    }

    @Test
    @DisplayName("should refuse duplicate routes")
    void shouldRefuseDuplicates() {
        assertThatThrownBy(() -> routes.add(Route.of("get", "/api/v1/tasks", null, OK)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("GET /api/v1/tasks");
    }
}
