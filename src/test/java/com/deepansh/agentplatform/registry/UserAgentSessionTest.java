package com.deepansh.agentplatform.registry;

import com.deepansh.agentplatform.agent.DefaultAgentInstance;
import com.deepansh.agentplatform.agent.ExecutionContext;
import com.deepansh.agentplatform.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UserAgentSessionTest {

    private UserAgentSession session;

    @BeforeEach
    void setUp() {
        session = new UserAgentSession("alice", MutableClock.startingNow());
    }

    @Test
    void register_duplicateType_isRejected() {
        assertThat(session.register("assistant", agent("assistant"))).isEqualTo(UserAgentSession.Registration.REGISTERED);
        assertThat(session.register("assistant", agent("assistant"))).isEqualTo(UserAgentSession.Registration.DUPLICATE);
        assertThat(session.getAgentCount()).isEqualTo(1);
    }

    @Test
    void closeAndReleaseAll_releasesAgentsAndRefusesNewOnes() {
        DefaultAgentInstance first = agent("assistant");
        session.register("assistant", first);

        UserAgentSession.Teardown teardown = session.closeAndReleaseAll();

        assertThat(teardown.agentsReleased()).isEqualTo(1);
        assertThat(first.isReleased()).isTrue();
        assertThat(session.isClosed()).isTrue();
        assertThat(session.register("researcher", agent("researcher"))).isEqualTo(UserAgentSession.Registration.CLOSED);
        assertThat(session.getAgentCount()).isZero();
    }

    @Test
    void estimatedMemoryBytes_usesDefaultForUnreportedAgents() {
        ExecutionContext context = ExecutionContext.builder().userId("alice").runId("r").agentType("big").build();
        session.register("big", new DefaultAgentInstance(context, 10_000, null));
        session.register("small", agent("small"));

        assertThat(session.estimatedMemoryBytes(500)).isEqualTo(10_500);
    }

    private static DefaultAgentInstance agent(String type) {
        return DefaultAgentInstance.of(ExecutionContext.builder()
                .userId("alice").runId("run").agentType(type).build());
    }
}
