package com.luxgrid.core.raster;

import com.luxgrid.core.config.LuxgridProperties;
import com.luxgrid.core.engine.ToolResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RasterConfig {

    @Bean
    public RasterDecoder rasterDecoder(LuxgridProperties properties, ToolResolver tools) {
        String decoder = properties.getAggregation().getDecoder();
        long maxPixels = properties.getAggregation().getMaxRasterPixels();
        return switch (decoder) {
            case "native" -> new RadianceHdrDecoder(maxPixels);
            case "pvalue" -> new PvalueRasterDecoder(tools, maxPixels);
            default -> throw new IllegalStateException(
                    "Unknown luxgrid.aggregation.decoder '" + decoder + "' (expected native or pvalue)");
        };
    }
}
