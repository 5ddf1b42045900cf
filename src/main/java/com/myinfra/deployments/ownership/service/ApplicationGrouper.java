package com.myinfra.deployments.ownership.service;

import com.myinfra.deployments.ownership.model.AccessLevel;
import com.myinfra.deployments.ownership.model.Application;
import com.myinfra.deployments.ownership.model.ApplicationGroup;
import com.myinfra.deployments.ownership.model.GroupSort;
import com.myinfra.deployments.ownership.model.OwnerDescriptor;
import com.myinfra.deployments.ownership.model.OwnerKind;
import com.myinfra.deployments.ownership.model.OwnershipSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Groups applications by owner for display.
 */
@Component
@RequiredArgsConstructor
public class ApplicationGrouper {

    private static final Comparator<ApplicationGroup> BY_NAME = Comparator
            .comparing((ApplicationGroup group) -> group.owner().displayName(), String.CASE_INSENSITIVE_ORDER)
            .thenComparing(group -> group.owner().displayName());

    private static final Comparator<ApplicationGroup> BY_COUNT = Comparator
            .comparingInt(ApplicationGroup::size).reversed()
            .thenComparing(BY_NAME);

    private final OwnerReferenceParser parser;

    /**
     * Groups applications by their owner, in order of first appearance.
     * The snapshot is only read.
     *
     * @param applications Applications to group
     * @param snapshot     Ownership snapshot of the same user
     * @return one group per owner
     */
    public List<ApplicationGroup> groupByOwner(List<Application> applications, OwnershipSnapshot snapshot) {
        Map<String, OwnerDescriptor> owners = new LinkedHashMap<>();
        Map<String, List<Application>> members = new LinkedHashMap<>();

        for (Application application : applications) {
            OwnerDescriptor owner = ownerOf(application, snapshot);
            String key = owner.ownerKey();

            owners.putIfAbsent(key, owner);
            members.computeIfAbsent(key, k -> new ArrayList<>()).add(application);
        }

        List<ApplicationGroup> groups = new ArrayList<>(owners.size());
        owners.forEach((key, owner) -> {
            List<Application> apps = members.get(key);
            boolean ownsAny = apps.stream().anyMatch(app -> snapshot.isUserOwned(app.name()));
            boolean userGroup = snapshot.userGroups().contains(owner.canonicalName()) || ownsAny;

            groups.add(new ApplicationGroup(owner, List.copyOf(apps), userGroup, accessLevelOf(owner, ownsAny, snapshot)));
        });

        return groups;
    }

    public List<ApplicationGroup> sortGroups(List<ApplicationGroup> groups, GroupSort sortBy) {
        Comparator<ApplicationGroup> order = sortBy == GroupSort.COUNT ? BY_COUNT : BY_NAME;
        return groups.stream().sorted(order).toList();
    }

    private OwnerDescriptor ownerOf(Application application, OwnershipSnapshot snapshot) {
        Optional<OwnerDescriptor> known = snapshot.ownerOf(application.name());
        if (known.isPresent()) {
            return known.get();
        }

        return application.ownerReference()
                .map(parser::parse)
                .map(owner -> owner.withDisplayName(humanize(owner.canonicalName())))
                .orElseGet(OwnerDescriptor::unassigned);
    }

    private static AccessLevel accessLevelOf(OwnerDescriptor owner, boolean ownsAny, OwnershipSnapshot snapshot) {
        if (owner.kind() == OwnerKind.USER && ownsAny) {
            return AccessLevel.FULL;
        }
        if (owner.kind() == OwnerKind.GROUP && snapshot.userGroups().contains(owner.canonicalName())) {
            return AccessLevel.FULL;
        }
        return AccessLevel.LIMITED;
    }

    /**
     * "platform-team" -> "Platform Team", "john.doe" -> "John Doe".
     */
    static String humanize(String name) {
        String[] words = name.split("[._-]");
        StringBuilder out = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return out.length() == 0 ? name : out.toString();
    }
}
