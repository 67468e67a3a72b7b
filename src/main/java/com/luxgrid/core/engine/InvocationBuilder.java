package com.luxgrid.core.engine;

import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.model.AmbientWarmJob;
import com.luxgrid.core.model.CompositeJob;
import com.luxgrid.core.model.ConditionCompileJob;
import com.luxgrid.core.model.ConvertJob;
import com.luxgrid.core.model.Job;
import com.luxgrid.core.model.RenderJob;
import com.luxgrid.core.model.SceneCompileJob;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns typed jobs into Radiance command lines.
 *
 * <pre>
 *   scene compile      oconv -i scene.oct ambient.sky                      &gt; out.oct
 *   ambient warm       rpict -w -t T -vf v.vp -x 64 -y 64 (ambient) -i -af out.amb scene.oct
 *   indirect render    rpict -w -t T -vf v.vp -x W -y H (ambient) -i -af v.amb scene.oct &gt; out.hdr
 *   condition compile  oconv -i staging.oct condition.sky                 &gt; out.oct
 *   direct render      rpict -w -t T -vf v.vp -x W -y H (direct) condition.oct &gt; out.hdr
 *   composite          pcomb -e SUM indirect.hdr direct.hdr                &gt; out.hdr
 *   convert            ra_tiff -e -4 combined.hdr out.tiff
 * </pre>
 */
@Component
public class InvocationBuilder {

    public static final List<String> TOOLS = List.of("oconv", "rpict", "pcomb", "ra_tiff", "pvalue");

    static final String SUM_EXPRESSION = "ro=ri(1)+ri(2);go=gi(1)+gi(2);bo=bi(1)+bi(2)";

    private final ToolResolver tools;
    private final LuxgridProperties.Render render;

    public InvocationBuilder(ToolResolver tools, LuxgridProperties properties) {
        this.tools = tools;
        this.render = properties.getRender();
    }

    public Invocation build(Job job) {
        if (job instanceof SceneCompileJob j) {
            return new Invocation(
                    List.of(tools.executable("oconv"), "-i", str(j.sceneOctree()), str(j.ambientSky())),
                    j.output(), null);
        }
        if (job instanceof AmbientWarmJob j) {
            var cmd = rpictHead(j.viewDescriptor(), render.getOvertureRes(), render.getOvertureRes());
            addAmbientSettings(cmd, render.getAmbientDivisions() / 2, render.getAmbientSupersamples() / 2);
            cmd.addAll(List.of("-i", "-af", str(j.output()), str(j.compiledScene())));
            return new Invocation(cmd, null, null);
        }
        if (job instanceof RenderJob j) {
            return renderInvocation(j);
        }
        if (job instanceof ConditionCompileJob j) {
            return new Invocation(
                    List.of(tools.executable("oconv"), "-i", str(j.stagingCopy()), str(j.conditionDescriptor())),
                    j.output(),
                    new Invocation.StagingCopy(j.sceneOctree(), j.stagingCopy()));
        }
        if (job instanceof CompositeJob j) {
            return new Invocation(
                    List.of(tools.executable("pcomb"), "-e", SUM_EXPRESSION,
                            str(j.indirectImage()), str(j.directImage())),
                    j.output(), null);
        }
        if (job instanceof ConvertJob j) {
            return new Invocation(
                    List.of(tools.executable("ra_tiff"), "-e", String.valueOf(render.getTiffExposure()),
                            str(j.source()), str(j.output())),
                    null, null);
        }
        throw new IllegalArgumentException("Unsupported job type: " + job.getClass().getSimpleName());
    }

    private Invocation renderInvocation(RenderJob job) {
        var cmd = rpictHead(job.viewDescriptor(), render.getImageWidth(), render.getImageHeight());
        if (job.kind() == RenderJob.Kind.INDIRECT) {
            addAmbientSettings(cmd, render.getAmbientDivisions(), render.getAmbientSupersamples());
            cmd.addAll(List.of("-i", "-af", str(job.ambientFile())));
        } else {
            cmd.addAll(List.of(
                    "-ab", String.valueOf(render.getDirectAmbientBounces()),
                    "-ad", String.valueOf(render.getDirectAmbientDivisions()),
                    "-ar", String.valueOf(render.getDirectAmbientResolution()),
                    "-as", String.valueOf(render.getDirectAmbientSupersamples()),
                    "-ps", String.valueOf(render.getDirectPixelSampling()),
                    "-lw", String.valueOf(render.getDirectLimitWeight())));
        }
        cmd.add(str(job.compiledScene()));
        return new Invocation(cmd, job.output(), null);
    }

    private List<String> rpictHead(Path view, int width, int height) {
        var cmd = new ArrayList<String>();
        cmd.add(tools.executable("rpict"));
        cmd.addAll(List.of(
                "-w", "-t", String.valueOf(render.getReportIntervalSeconds()),
                "-vf", str(view),
                "-x", String.valueOf(width), "-y", String.valueOf(height)));
        return cmd;
    }

    private void addAmbientSettings(List<String> cmd, int divisions, int supersamples) {
        cmd.addAll(List.of(
                "-aa", String.valueOf(render.getAmbientAccuracy()),
                "-ab", String.valueOf(render.getAmbientBounces()),
                "-ad", String.valueOf(divisions),
                "-ar", String.valueOf(render.getAmbientResolution()),
                "-as", String.valueOf(supersamples),
                "-ps", String.valueOf(render.getPixelSampling()),
                "-pt", String.valueOf(render.getPixelThreshold()),
                "-pj", String.valueOf(render.getPixelJitter()),
                "-dj", String.valueOf(render.getDirectJitter()),
                "-lr", String.valueOf(render.getLimitReflection()),
                "-lw", String.valueOf(render.getLimitWeight())));
    }

    private static String str(Path path) {
        return path.toString();
    }
}
