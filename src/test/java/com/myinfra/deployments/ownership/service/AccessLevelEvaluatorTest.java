package com.myinfra.deployments.ownership.service;

import com.myinfra.deployments.ownership.config.AppConfig;
import com.myinfra.deployments.ownership.model.AccessLevel;
import com.myinfra.deployments.ownership.model.Application;
import com.myinfra.deployments.ownership.model.OwnerDescriptor;
import com.myinfra.deployments.ownership.model.OwnerKind;
import com.myinfra.deployments.ownership.model.OwnershipSnapshot;
import com.myinfra.deployments.ownership.model.RawOwner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class AccessLevelEvaluatorTest {

    private AppConfig appConfig;
    private AccessLevelEvaluator evaluator;
    private OwnershipSnapshot snapshot;

    @BeforeEach
    void setUp() {
        appConfig = new AppConfig();
        evaluator = new AccessLevelEvaluator(appConfig);

        OwnerDescriptor alice = new OwnerDescriptor(OwnerKind.USER, "alice", "alice");
        OwnerDescriptor team = new OwnerDescriptor(OwnerKind.GROUP, "platform-team", "Platform Team");
        OwnerDescriptor other = new OwnerDescriptor(OwnerKind.GROUP, "other", "other");
        snapshot = new OwnershipSnapshot(
                Set.of("mine"),
                Map.of("platform-team", Set.of("team-app")),
                Map.of("mine", alice, "team-app", team, "foreign", other),
                Set.of("platform-team"));
    }

    @Test
    @DisplayName("evaluate should grant FULL for direct and group ownership")
    void evaluate_shouldGrantFull_whenOwned() {
        assertThat(evaluator.evaluate(snapshot, Application.of("mine", "user:default/alice")))
                .isEqualTo(AccessLevel.FULL);
        assertThat(evaluator.evaluate(snapshot, Application.of("team-app", "group:default/platform-team")))
                .isEqualTo(AccessLevel.FULL);
    }

    @Test
    @DisplayName("evaluate should grant LIMITED for a foreign application with an integration annotation")
    void evaluate_shouldGrantLimited_whenIntegrated() {
        Application foreign = new Application("foreign", new RawOwner("group:default/other"),
                Map.of("github.com/project-slug", "acme/foreign"));

        assertThat(evaluator.evaluate(snapshot, foreign)).isEqualTo(AccessLevel.LIMITED);
    }

    @Test
    @DisplayName("evaluate should ignore blank integration annotations")
    void evaluate_shouldGrantNone_whenAnnotationBlank() {
        Application foreign = new Application("foreign", new RawOwner("group:default/other"),
                Map.of("github.com/project-slug", " ", "backstage.io/source-location", "url:https://example.com"));

        assertThat(evaluator.evaluate(snapshot, foreign)).isEqualTo(AccessLevel.NONE);
    }

    @Test
    @DisplayName("evaluate should honour configured integration annotations")
    void evaluate_shouldUseConfiguredAnnotations() {
        appConfig.getOwnership().setIntegrationAnnotations(List.of("gitlab.com/project-slug"));
        Application gitlab = new Application("foreign", null, Map.of("gitlab.com/project-slug", "acme/foreign"));
        Application github = new Application("foreign", null, Map.of("github.com/project-slug", "acme/foreign"));

        assertThat(evaluator.evaluate(snapshot, gitlab)).isEqualTo(AccessLevel.LIMITED);
        assertThat(evaluator.evaluate(snapshot, github)).isEqualTo(AccessLevel.NONE);
    }

    @Test
    @DisplayName("access levels should be ordered by privilege")
    void accessLevel_shouldOrderByPrivilege() {
        assertThat(AccessLevel.FULL.isAtLeast(AccessLevel.LIMITED)).isTrue();
        assertThat(AccessLevel.LIMITED.isAtLeast(AccessLevel.NONE)).isTrue();
        assertThat(AccessLevel.NONE.isAtLeast(AccessLevel.LIMITED)).isFalse();
        assertThat(AccessLevel.LIMITED.isAtLeast(AccessLevel.LIMITED)).isTrue();
    }
}
