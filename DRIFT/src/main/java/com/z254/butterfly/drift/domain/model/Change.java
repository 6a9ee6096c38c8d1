package com.z254.butterfly.drift.domain.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single drifted resource snapshot file awaiting attribution.
 * <p>
 * Identity is (provider, resource type, project id); the attribution state
 * (message, diff, commit, changers) is mutated by the attributor during one
 * batch and does not take part in equality.
 */
@Getter
@Setter
@Builder
@ToString(exclude = "diff")
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Change {

    private static final String SNAPSHOT_EXTENSION = ".yaml";

    @EqualsAndHashCode.Include
    private final Provider provider;

    @EqualsAndHashCode.Include
    private final String resourceType;

    @EqualsAndHashCode.Include
    private final String projectId;

    /** Commit message, built incrementally while attributing */
    private String message;

    /** Diff of the commit recording this change */
    private String diff;

    /** Commit id recording this change */
    private String commitId;

    /** True once a changer not matching the automation pattern was seen */
    private boolean manual;

    /** Distinct changer identities in first-seen order */
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private List<String> changers = new ArrayList<>();

    public static Change of(Provider provider, String resourceType, String projectId) {
        return Change.builder()
                .provider(provider)
                .resourceType(resourceType)
                .projectId(projectId)
                .build();
    }

    /**
     * Path of the snapshot file relative to the repository root.
     */
    public String filePath() {
        return provider.getDirectory() + "/" + resourceType + "/" + projectId + SNAPSHOT_EXTENSION;
    }

    public boolean addChanger(String changer) {
        if (changers.contains(changer)) {
            return false;
        }
        changers.add(changer);
        return true;
    }

    public List<String> getChangers() {
        return Collections.unmodifiableList(changers);
    }
}
