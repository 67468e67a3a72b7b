package com.luxgrid.core.planner;

import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.model.AmbientWarmJob;
import com.luxgrid.core.model.BaseScene;
import com.luxgrid.core.model.CompositeJob;
import com.luxgrid.core.model.ConditionCompileJob;
import com.luxgrid.core.model.ConvertJob;
import com.luxgrid.core.model.Job;
import com.luxgrid.core.model.LightingCondition;
import com.luxgrid.core.model.Phase;
import com.luxgrid.core.model.RenderJob;
import com.luxgrid.core.model.SceneCompileJob;
import com.luxgrid.core.model.Viewpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands a base scene, its lighting conditions and its viewpoints into the
 * full list of jobs for every phase.
 *
 * <p>The cross-product is walked condition-major. For every (condition, view)
 * pair the planner emits the whole chain of jobs that pair needs; upstream jobs
 * shared between pairs (the scene compile, the per-view ambient warm and
 * indirect render, the per-condition compile) collapse onto the first
 * occurrence, keyed by declared output path. The returned list keeps that
 * first-seen order.
 */
@Service
public class JobPlanner {

    private static final Logger log = LoggerFactory.getLogger(JobPlanner.class);

    private final ArtifactNames names;

    @Autowired
    public JobPlanner(LuxgridProperties properties) {
        this(new ArtifactNames(properties.getSceneDir(), properties.getImageDir()));
    }

    JobPlanner(ArtifactNames names) {
        this.names = names;
    }

    /**
     * Plans every job for the given inputs.
     *
     * @return jobs in first-seen order; empty when there are no conditions or no viewpoints
     * @throws PlanningException if the scene is missing or an id is blank, duplicated or path-like
     */
    public List<Job> plan(BaseScene scene, List<LightingCondition> conditions, List<Viewpoint> viewpoints) {
        validate(scene, conditions, viewpoints);

        if (conditions.isEmpty() || viewpoints.isEmpty()) {
            log.info("Nothing to plan: {} conditions, {} viewpoints", conditions.size(), viewpoints.size());
            return List.of();
        }

        var planned = new LinkedHashMap<Path, Job>();
        Path ambientScene = names.compiledAmbientScene(scene);

        for (var condition : conditions) {
            Path conditionScene = names.compiledConditionScene(scene, condition);
            for (var view : viewpoints) {
                Path ambientFile = names.ambientFile(scene, view);
                Path indirect = names.indirectImage(scene, view);
                Path direct = names.directImage(scene, view, condition);
                Path composite = names.compositeImage(scene, view, condition);

                add(planned, new SceneCompileJob(scene.sceneOctree(), scene.ambientSky(), ambientScene));
                add(planned, new AmbientWarmJob(view.descriptor(), ambientScene, ambientFile));
                add(planned, new RenderJob(RenderJob.Kind.INDIRECT, view.descriptor(), ambientScene,
                        ambientFile, indirect));
                add(planned, new ConditionCompileJob(scene.sceneOctree(), condition.descriptor(),
                        names.stagingCopy(scene, condition), conditionScene));
                add(planned, new RenderJob(RenderJob.Kind.DIRECT, view.descriptor(), conditionScene,
                        null, direct));
                add(planned, new CompositeJob(indirect, direct, composite));
                add(planned, new ConvertJob(composite, names.convertedImage(scene, view, condition)));
            }
        }

        var jobs = List.copyOf(planned.values());
        log.info("Planned {} jobs for {} conditions x {} viewpoints: {}",
                jobs.size(), conditions.size(), viewpoints.size(), countByPhase(jobs));
        return jobs;
    }

    /**
     * Plans only the jobs of one phase, in the same first-seen order as {@link #plan}.
     */
    public List<Job> planPhase(Phase phase, BaseScene scene, List<LightingCondition> conditions,
                               List<Viewpoint> viewpoints) {
        return plan(scene, conditions, viewpoints).stream()
                .filter(job -> job.phase() == phase)
                .toList();
    }

    private void add(Map<Path, Job> planned, Job job) {
        Job existing = planned.putIfAbsent(job.output(), job);
        if (existing != null) {
            log.trace("  {} already planned", job.id());
        }
    }

    private void validate(BaseScene scene, List<LightingCondition> conditions, List<Viewpoint> viewpoints) {
        if (scene == null || scene.sceneOctree() == null || scene.ambientSky() == null) {
            throw new PlanningException("A base scene octree and an ambient sky are required");
        }
        if (conditions == null || viewpoints == null) {
            throw new PlanningException("Condition and viewpoint lists are required (they may be empty)");
        }
        var conditionIds = new HashSet<String>();
        for (var condition : conditions) {
            checkId("condition", condition.id());
            if (!conditionIds.add(condition.id())) {
                throw new PlanningException("Duplicate condition id: " + condition.id());
            }
        }
        var viewIds = new HashSet<String>();
        for (var view : viewpoints) {
            checkId("viewpoint", view.id());
            if (!viewIds.add(view.id())) {
                throw new PlanningException("Duplicate viewpoint id: " + view.id());
            }
        }
    }

    private static void checkId(String kind, String id) {
        if (id == null || id.isBlank()) {
            throw new PlanningException("Blank " + kind + " id");
        }
        if (id.contains("/") || id.contains("\\")) {
            throw new PlanningException("Invalid " + kind + " id (path separator): " + id);
        }
    }

    private static Map<Phase, Integer> countByPhase(List<Job> jobs) {
        var counts = new EnumMap<Phase, Integer>(Phase.class);
        for (var job : jobs) {
            counts.merge(job.phase(), 1, Integer::sum);
        }
        return counts;
    }
}
