package com.luxgrid.core.config;

import com.luxgrid.core.model.Phase;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "luxgrid")
public class LuxgridProperties {

    private Directories directories = new Directories();
    private Toolchain toolchain = new Toolchain();
    private Workers workers = new Workers();
    private Render render = new Render();
    private Aggregation aggregation = new Aggregation();

    // -- Directory accessors (delegate to nested) --
    public Path getSceneDir() { return Path.of(directories.sceneDir); }
    public Path getSkyDir() { return Path.of(directories.skyDir); }
    public Path getViewDir() { return Path.of(directories.viewDir); }
    public Path getImageDir() { return Path.of(directories.imageDir); }
    public Path getRegionDir() { return Path.of(directories.regionDir); }
    public Path getResultDir() { return Path.of(directories.resultDir); }
    public Path getDaylightDir() { return Path.of(directories.daylightDir); }

    /**
     * Worker count for a phase, capped at the number of available processors.
     */
    public int workersFor(Phase phase) {
        int configured = switch (phase) {
            case SCENE_COMPILE -> workers.sceneCompile;
            case AMBIENT_WARM -> workers.ambientWarm;
            case CONDITION_COMPILE -> workers.conditionCompile;
            case RENDER -> workers.render;
            case COMPOSITE -> workers.composite;
            case CONVERT -> workers.convert;
        };
        return capped(configured);
    }

    public int aggregationWorkers() {
        return capped(workers.aggregation);
    }

    private static int capped(int configured) {
        return Math.max(1, Math.min(configured, Runtime.getRuntime().availableProcessors()));
    }

    public Directories getDirectories() { return directories; }
    public void setDirectories(Directories directories) { this.directories = directories; }
    public Toolchain getToolchain() { return toolchain; }
    public void setToolchain(Toolchain toolchain) { this.toolchain = toolchain; }
    public Workers getWorkers() { return workers; }
    public void setWorkers(Workers workers) { this.workers = workers; }
    public Render getRender() { return render; }
    public void setRender(Render render) { this.render = render; }
    public Aggregation getAggregation() { return aggregation; }
    public void setAggregation(Aggregation aggregation) { this.aggregation = aggregation; }

    public static class Directories {
        private String sceneDir = "outputs/octree";
        private String skyDir = "outputs/sky";
        private String viewDir = "outputs/view";
        private String imageDir = "outputs/image";
        private String regionDir = "outputs/aoi";
        private String resultDir = "outputs/wpd";
        private String daylightDir = "outputs/daylight";

        public String getSceneDir() { return sceneDir; }
        public void setSceneDir(String sceneDir) { this.sceneDir = sceneDir; }
        public String getSkyDir() { return skyDir; }
        public void setSkyDir(String skyDir) { this.skyDir = skyDir; }
        public String getViewDir() { return viewDir; }
        public void setViewDir(String viewDir) { this.viewDir = viewDir; }
        public String getImageDir() { return imageDir; }
        public void setImageDir(String imageDir) { this.imageDir = imageDir; }
        public String getRegionDir() { return regionDir; }
        public void setRegionDir(String regionDir) { this.regionDir = regionDir; }
        public String getResultDir() { return resultDir; }
        public void setResultDir(String resultDir) { this.resultDir = resultDir; }
        public String getDaylightDir() { return daylightDir; }
        public void setDaylightDir(String daylightDir) { this.daylightDir = daylightDir; }
    }

    public static class Toolchain {
        /** Directory holding the Radiance binaries; empty means resolve from PATH. */
        private String binDir = "";
        /** RAYPATH passed to every process; empty leaves the inherited value. */
        private String raypath = "";
        /** Write redirected stdout to a .partial file and move it into place on success. */
        private boolean atomicOutputs = true;

        public String getBinDir() { return binDir; }
        public void setBinDir(String binDir) { this.binDir = binDir; }
        public String getRaypath() { return raypath; }
        public void setRaypath(String raypath) { this.raypath = raypath; }
        public boolean isAtomicOutputs() { return atomicOutputs; }
        public void setAtomicOutputs(boolean atomicOutputs) { this.atomicOutputs = atomicOutputs; }
    }

    public static class Workers {
        private int sceneCompile = 1;
        private int ambientWarm = 8;
        private int conditionCompile = 12;
        private int render = 18;
        private int composite = 18;
        private int convert = 18;
        private int aggregation = 14;

        public int getSceneCompile() { return sceneCompile; }
        public void setSceneCompile(int sceneCompile) { this.sceneCompile = sceneCompile; }
        public int getAmbientWarm() { return ambientWarm; }
        public void setAmbientWarm(int ambientWarm) { this.ambientWarm = ambientWarm; }
        public int getConditionCompile() { return conditionCompile; }
        public void setConditionCompile(int conditionCompile) { this.conditionCompile = conditionCompile; }
        public int getRender() { return render; }
        public void setRender(int render) { this.render = render; }
        public int getComposite() { return composite; }
        public void setComposite(int composite) { this.composite = composite; }
        public int getConvert() { return convert; }
        public void setConvert(int convert) { this.convert = convert; }
        public int getAggregation() { return aggregation; }
        public void setAggregation(int aggregation) { this.aggregation = aggregation; }
    }

    /**
     * rpict, pcomb and ra_tiff parameters. Ambient values drive the overture and
     * indirect renders; direct values drive the per-condition sun renders.
     */
    public static class Render {
        private int imageWidth = 1024;
        private int imageHeight = 1024;
        private int overtureRes = 64;
        private int reportIntervalSeconds = 2;

        private double ambientAccuracy = 0.1;
        private int ambientBounces = 1;
        private int ambientDivisions = 4096;
        private int ambientResolution = 1024;
        private int ambientSupersamples = 1024;
        private double directJitter = 0.7;
        private int limitReflection = 12;
        private double limitWeight = 0.002;
        private int pixelJitter = 1;
        private int pixelSampling = 4;
        private double pixelThreshold = 0.05;

        private int directAmbientBounces = 0;
        private int directAmbientDivisions = 128;
        private int directAmbientResolution = 64;
        private int directAmbientSupersamples = 64;
        private int directPixelSampling = 2;
        private double directLimitWeight = 0.005;

        private int tiffExposure = -4;

        public int getImageWidth() { return imageWidth; }
        public void setImageWidth(int imageWidth) { this.imageWidth = imageWidth; }
        public int getImageHeight() { return imageHeight; }
        public void setImageHeight(int imageHeight) { this.imageHeight = imageHeight; }
        public int getOvertureRes() { return overtureRes; }
        public void setOvertureRes(int overtureRes) { this.overtureRes = overtureRes; }
        public int getReportIntervalSeconds() { return reportIntervalSeconds; }
        public void setReportIntervalSeconds(int reportIntervalSeconds) { this.reportIntervalSeconds = reportIntervalSeconds; }
        public double getAmbientAccuracy() { return ambientAccuracy; }
        public void setAmbientAccuracy(double ambientAccuracy) { this.ambientAccuracy = ambientAccuracy; }
        public int getAmbientBounces() { return ambientBounces; }
        public void setAmbientBounces(int ambientBounces) { this.ambientBounces = ambientBounces; }
        public int getAmbientDivisions() { return ambientDivisions; }
        public void setAmbientDivisions(int ambientDivisions) { this.ambientDivisions = ambientDivisions; }
        public int getAmbientResolution() { return ambientResolution; }
        public void setAmbientResolution(int ambientResolution) { this.ambientResolution = ambientResolution; }
        public int getAmbientSupersamples() { return ambientSupersamples; }
        public void setAmbientSupersamples(int ambientSupersamples) { this.ambientSupersamples = ambientSupersamples; }
        public double getDirectJitter() { return directJitter; }
        public void setDirectJitter(double directJitter) { this.directJitter = directJitter; }
        public int getLimitReflection() { return limitReflection; }
        public void setLimitReflection(int limitReflection) { this.limitReflection = limitReflection; }
        public double getLimitWeight() { return limitWeight; }
        public void setLimitWeight(double limitWeight) { this.limitWeight = limitWeight; }
        public int getPixelJitter() { return pixelJitter; }
        public void setPixelJitter(int pixelJitter) { this.pixelJitter = pixelJitter; }
        public int getPixelSampling() { return pixelSampling; }
        public void setPixelSampling(int pixelSampling) { this.pixelSampling = pixelSampling; }
        public double getPixelThreshold() { return pixelThreshold; }
        public void setPixelThreshold(double pixelThreshold) { this.pixelThreshold = pixelThreshold; }
        public int getDirectAmbientBounces() { return directAmbientBounces; }
        public void setDirectAmbientBounces(int directAmbientBounces) { this.directAmbientBounces = directAmbientBounces; }
        public int getDirectAmbientDivisions() { return directAmbientDivisions; }
        public void setDirectAmbientDivisions(int directAmbientDivisions) { this.directAmbientDivisions = directAmbientDivisions; }
        public int getDirectAmbientResolution() { return directAmbientResolution; }
        public void setDirectAmbientResolution(int directAmbientResolution) { this.directAmbientResolution = directAmbientResolution; }
        public int getDirectAmbientSupersamples() { return directAmbientSupersamples; }
        public void setDirectAmbientSupersamples(int directAmbientSupersamples) { this.directAmbientSupersamples = directAmbientSupersamples; }
        public int getDirectPixelSampling() { return directPixelSampling; }
        public void setDirectPixelSampling(int directPixelSampling) { this.directPixelSampling = directPixelSampling; }
        public double getDirectLimitWeight() { return directLimitWeight; }
        public void setDirectLimitWeight(double directLimitWeight) { this.directLimitWeight = directLimitWeight; }
        public int getTiffExposure() { return tiffExposure; }
        public void setTiffExposure(int tiffExposure) { this.tiffExposure = tiffExposure; }
    }

    public static class Aggregation {
        /** Pixels strictly above this value pass. */
        private double threshold = 0.0;
        /** "native" decodes RGBE in-process, "pvalue" shells out to pvalue. */
        private String decoder = "native";
        /** Pictures with more pixels than this are skipped instead of decoded. */
        private long maxRasterPixels = 1L << 28;
        /** Pixel-to-world map file; when empty the scale is read from the first raster's VIEW header. */
        private String pixelToWorldMap = "";
        /** Minimum passing area (m2) for a raster to count towards a consecutive run. */
        private double minPassingArea = 1.0;
        /** Default timestep when raster ids carry no time suffix. */
        private double defaultTimestepHours = 1.0;
        /** Rasters picked up from the image directory for aggregation. */
        private String rasterGlob = "*_combined.hdr";
        /** Daylight factor compliance thresholds, in percent. */
        private List<Double> dfThresholds = new ArrayList<>(List.of(0.5, 1.0, 2.0));
        /** Rasters picked up for daylight factor extraction, one per view. */
        private String daylightRasterGlob = "*.hdr";

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
        public String getDecoder() { return decoder; }
        public void setDecoder(String decoder) { this.decoder = decoder; }
        public long getMaxRasterPixels() { return maxRasterPixels; }
        public void setMaxRasterPixels(long maxRasterPixels) { this.maxRasterPixels = maxRasterPixels; }
        public String getPixelToWorldMap() { return pixelToWorldMap; }
        public void setPixelToWorldMap(String pixelToWorldMap) { this.pixelToWorldMap = pixelToWorldMap; }
        public double getMinPassingArea() { return minPassingArea; }
        public void setMinPassingArea(double minPassingArea) { this.minPassingArea = minPassingArea; }
        public double getDefaultTimestepHours() { return defaultTimestepHours; }
        public void setDefaultTimestepHours(double defaultTimestepHours) { this.defaultTimestepHours = defaultTimestepHours; }
        public String getRasterGlob() { return rasterGlob; }
        public void setRasterGlob(String rasterGlob) { this.rasterGlob = rasterGlob; }
        public List<Double> getDfThresholds() { return dfThresholds; }
        public void setDfThresholds(List<Double> dfThresholds) { this.dfThresholds = dfThresholds; }
        public String getDaylightRasterGlob() { return daylightRasterGlob; }
        public void setDaylightRasterGlob(String daylightRasterGlob) { this.daylightRasterGlob = daylightRasterGlob; }
    }
}
