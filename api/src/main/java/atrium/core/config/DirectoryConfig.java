package atrium.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for the profile directory use cases.
 *
 * <p>Configuration prefix: {@code atrium.directory}
 */
@ConfigMapping(prefix = "atrium.directory")
public interface DirectoryConfig {

    /**
     * @return page size used when a search does not pass {@code limit} (default: 10)
     */
    @WithName("default-page-size")
    @WithDefault("10")
    int defaultPageSize();

    /**
     * Load a small set of sample profiles into the in-memory store on startup.
     *
     * @return true to seed sample data (default: false)
     */
    @WithName("seed-sample-profiles")
    @WithDefault("false")
    boolean seedSampleProfiles();
}
