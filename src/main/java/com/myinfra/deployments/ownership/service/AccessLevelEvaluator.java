package com.myinfra.deployments.ownership.service;

import com.myinfra.deployments.ownership.config.AppConfig;
import com.myinfra.deployments.ownership.model.AccessLevel;
import com.myinfra.deployments.ownership.model.Application;
import com.myinfra.deployments.ownership.model.OwnershipSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Derives an application's access level from an ownership snapshot.
 *
 * <ul>
 *   <li>FULL: owned by the user or one of the user's groups</li>
 *   <li>LIMITED: not owned, but carries an integration annotation (e.g., "github.com/project-slug")</li>
 *   <li>NONE: otherwise</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class AccessLevelEvaluator {

    private final AppConfig appConfig;

    public AccessLevel evaluate(OwnershipSnapshot snapshot, Application application) {
        if (snapshot.isOwned(application.name())) {
            return AccessLevel.FULL;
        }

        // TODO: check repository permissions with the source-control provider instead of granting LIMITED
        if (hasIntegration(application)) {
            return AccessLevel.LIMITED;
        }

        return AccessLevel.NONE;
    }

    public boolean hasIntegration(Application application) {
        return appConfig.getOwnership().getIntegrationAnnotations().stream()
                .anyMatch(key -> application.annotation(key).isPresent());
    }
}
