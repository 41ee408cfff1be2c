package com.architecture.memory.inevitability.service.analysis;

import com.architecture.memory.inevitability.dto.AttackPathStep;
import com.architecture.memory.inevitability.model.goal.GoalPredicate;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.service.scm.AcyclicityChecker;
import com.architecture.memory.inevitability.service.scm.ScmBuilder;
import com.architecture.memory.inevitability.service.scm.ScmCanonicalizer;
import com.architecture.memory.inevitability.support.TestGraphs;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AttackPathTracerTest {

    private static final GoalPredicate DATABASE = GoalPredicate.compromise("database");

    private final ScmBuilder scmBuilder = new ScmBuilder(new AcyclicityChecker(), new ScmCanonicalizer());
    private final AttackPathTracer tracer = new AttackPathTracer(scmBuilder);
    private final StructuralCausalModel scm = scmBuilder.build(TestGraphs.corporate());

    private final Map<String, Boolean> breach = Map.of(
            "vpn_user", true, "vpn", true, "admin", true, "database", true,
            "mfa", false, "edr", false, "dlp", true, "print_server", false);

    @Test
    void tracesPathFromRootToGoal() {
        List<AttackPathStep> steps = tracer.trace(scm, DATABASE, breach);

        assertThat(steps).extracting(AttackPathStep::getStepNumber).containsExactly(1, 2, 3);
        assertThat(steps).extracting(AttackPathStep::getTargetNode).containsExactly("vpn", "admin", "database");
        assertThat(steps).extracting(AttackPathStep::getEdgeType).containsExactly("ACCESS", "ESCALATION", "PRIVILEGE");
    }

    @Test
    void phrasesStepsByTargetType() {
        List<AttackPathStep> steps = tracer.trace(scm, DATABASE, breach);

        assertThat(steps).extracting(AttackPathStep::getStatement).containsExactly(
                "BECAUSE 'VPN User' enables network path to 'VPN Gateway'",
                "BECAUSE 'VPN Gateway' has escalation to 'Domain Admin'",
                "BECAUSE 'Domain Admin' provides privilege, 'Customer DB' is compromised");
    }

    @Test
    void returnsSameExplanation_forSameWitness() {
        assertThat(tracer.trace(scm, DATABASE, breach)).isEqualTo(tracer.trace(scm, DATABASE, breach));
    }

    @Test
    void returnsNoSteps_whenGoalFalseInWitness() {
        assertThat(tracer.trace(scm, DATABASE, Map.of("database", false))).isEmpty();
        assertThat(tracer.trace(scm, DATABASE, Map.of())).isEmpty();
    }

    @Test
    void collectsNodesOnPath() {
        assertThat(tracer.pathNodes(scm, DATABASE, breach))
                .containsExactly("admin", "database", "vpn", "vpn_user");
    }
}
