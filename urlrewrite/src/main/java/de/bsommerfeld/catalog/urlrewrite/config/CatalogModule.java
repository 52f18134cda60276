package de.bsommerfeld.catalog.urlrewrite.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.config.ApplicationMode;
import de.bsommerfeld.catalog.core.config.CatalogConfig;
import de.bsommerfeld.catalog.core.config.ConfigLoader;
import de.bsommerfeld.catalog.core.util.StorageUtils;
import de.bsommerfeld.catalog.db.CategoryDatabaseService;
import de.bsommerfeld.catalog.db.CategoryRepository;
import de.bsommerfeld.catalog.db.CategoryResource;
import de.bsommerfeld.catalog.db.SqlCategoryService;
import de.bsommerfeld.catalog.db.TestCategoryService;
import de.bsommerfeld.catalog.urlrewrite.map.CategoryHashMap;
import de.bsommerfeld.catalog.urlrewrite.map.CategoryMapInvalidator;
import de.bsommerfeld.catalog.urlrewrite.map.DataCategoryHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module wiring configuration, the category store and the category
 * hash map.
 */
public class CatalogModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogModule.class);

    private final Path configPath;
    private final ApplicationMode mode;

    public CatalogModule() {
        this(StorageUtils.getConfigFile(), ApplicationMode.get());
    }

    public CatalogModule(Path configPath, ApplicationMode mode) {
        this.configPath = configPath;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());
        CatalogConfig config = ConfigLoader.load(configPath);
        bind(CatalogConfig.class).toInstance(config);

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            bind(CategoryDatabaseService.class).to(TestCategoryService.class);
        } else {
            bind(CategoryDatabaseService.class).to(SqlCategoryService.class);
        }
        bind(CategoryRepository.class).to(CategoryDatabaseService.class);
        bind(CategoryResource.class).to(CategoryDatabaseService.class);

        bind(CategoryHashMap.class).to(DataCategoryHashMap.class);
        bind(CategoryMapInvalidator.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    DataCategoryHashMap provideDataCategoryHashMap(CategoryRepository repository, CategoryResource resource,
            CatalogConfig config) {
        DataCategoryHashMap hashMap = new DataCategoryHashMap(repository, resource);
        hashMap.warmup(config.getCache().getWarmupCategoryIds());
        return hashMap;
    }
}
