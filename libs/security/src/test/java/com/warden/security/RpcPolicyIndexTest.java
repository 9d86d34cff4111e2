package com.warden.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RpcPolicyIndex")
class RpcPolicyIndexTest {

    static class Handlers {

        @RpcPolicy(anonymous = true, noLog = true)
        public void checkHealth() {
        }

        @RpcPolicy(targetResource = TargetResource.PROJECT, ownerOnly = true)
        public void createProject() {
        }
    }

    static class Incomplete {

        @RpcPolicy(anonymous = true)
        public void declared() {
        }

        public void undeclared() {
        }
    }

    private static RpcPolicyIndex index() throws NoSuchMethodException {
        return RpcPolicyIndex.fromMethods(Map.of(
                "warden.v1.HealthService/CheckHealth", Handlers.class.getMethod("checkHealth"),
                "warden.v1.ProjectService/CreateProject", Handlers.class.getMethod("createProject")));
    }

    @Test
    @DisplayName("reads declared policies by full method name")
    void declared() throws Exception {
        var index = index();

        var health = index.lookup("warden.v1.HealthService/CheckHealth");
        assertThat(health.anonymous()).isTrue();
        assertThat(health.noLog()).isTrue();

        var create = index.lookup("warden.v1.ProjectService/CreateProject");
        assertThat(create.targetsProject()).isTrue();
        assertThat(create.ownerOnly()).isTrue();
        assertThat(create.rootAdminOnly()).isFalse();
    }

    @Test
    @DisplayName("refuses to build when a handler method declares no policy")
    void undeclared() throws Exception {
        Map<String, Method> handlers = Map.of(
                "warden.v1.Other/Declared", Incomplete.class.getMethod("declared"),
                "warden.v1.Other/Undeclared", Incomplete.class.getMethod("undeclared"));

        assertThatThrownBy(() -> RpcPolicyIndex.fromMethods(handlers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("RPC methods without a policy: [warden.v1.Other/Undeclared]");
    }

    @Test
    @DisplayName("unknown methods get the default policy")
    void defaults() throws Exception {
        var index = index();

        assertThat(index.size()).isEqualTo(2);
        assertThat(index.lookup("warden.v1.Nope/Nope")).isEqualTo(MethodPolicy.DEFAULT);
        assertThat(MethodPolicy.DEFAULT.targetResource()).isEqualTo(TargetResource.NONE);
        assertThat(MethodPolicy.DEFAULT.anonymous()).isFalse();
    }
}
