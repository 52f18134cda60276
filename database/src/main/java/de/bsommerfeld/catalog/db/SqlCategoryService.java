package de.bsommerfeld.catalog.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.config.CatalogConfig;
import de.bsommerfeld.catalog.core.domain.Category;
import de.bsommerfeld.catalog.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQLite-backed {@link CategoryDatabaseService} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level anyway, so pooling
 * provides no benefit here.
 *
 * <h3>Descendant lookup</h3>
 * The tree is stored as a materialized path ({@code "1/2/5"}). A subtree is
 * the row whose path equals the prefix plus every row whose path is
 * {@code LIKE prefix || '/%'}. The separator is part of the pattern so that
 * {@code 1/2} never picks up {@code 1/20}. The {@code path} index keeps the
 * {@code LIKE} scan cheap.
 *
 * <h3>Failures</h3>
 * Every {@link SQLException} surfaces as a {@link CategoryQueryException}.
 * Multi-row writes run in a transaction and are rolled back first.
 */
@Singleton
public class SqlCategoryService implements CategoryDatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlCategoryService.class);
    private final String dbUrl;

    @Inject
    public SqlCategoryService(CatalogConfig config) {
        this(toJdbcUrl(StorageUtils.resolveDatabaseFile(config.getDatabase().getFile())));
    }

    /**
     * @param dbUrl full JDBC url, e.g. {@code jdbc:sqlite:/tmp/catalog.db}
     */
    public SqlCategoryService(String dbUrl) {
        this.dbUrl = dbUrl;
        initialize();
    }

    private static String toJdbcUrl(Path dbFile) {
        Path parent = dbFile.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new CategoryQueryException("Failed to create database directory " + parent, e);
        }
        return "jdbc:sqlite:" + dbFile.toAbsolutePath();
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private void initialize() {
        LOG.info("Initializing category database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new CategoryQueryException("Database initialization failed", e);
        }
    }

    /**
     * Applies the DDL from {@code schema.sql}, one statement at a time, inside a
     * single transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        String schemaSql;
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (schemaStream == null) {
                throw new IllegalStateException("schema.sql not found in classpath");
            }
            schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema.sql", e);
        }

        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty())
                    continue;
                stmt.execute(sql.trim());
            }
            conn.commit();
            LOG.info("Category schema applied.");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }

    // =====================================================================
    // Reads
    // =====================================================================

    @Override
    public Category get(int categoryId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-category"))) {
            ps.setInt(1, categoryId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new CategoryNotFoundException(categoryId);
                }
                return mapCategory(rs);
            }
        } catch (SQLException e) {
            throw new CategoryQueryException("Failed to load category " + categoryId, e);
        }
    }

    @Override
    public List<Integer> findIdsByPathPrefix(String prefix) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-ids-by-path-prefix"))) {
            bindSubtree(ps, prefix);
            List<Integer> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getInt(1));
                }
            }
            LOG.debug("[DB] {} ids under path {}", ids.size(), prefix);
            return ids;
        } catch (SQLException e) {
            throw new CategoryQueryException("Failed to query ids under path " + prefix, e);
        }
    }

    @Override
    public List<Category> getAllCategories() {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-categories"));
                ResultSet rs = ps.executeQuery()) {
            List<Category> all = new ArrayList<>();
            while (rs.next()) {
                all.add(mapCategory(rs));
            }
            return all;
        } catch (SQLException e) {
            throw new CategoryQueryException("Failed to load categories", e);
        }
    }

    // =====================================================================
    // Writes
    // =====================================================================

    @Override
    public void saveCategory(Category category) {
        saveCategoriesBatch(Collections.singletonList(category));
    }

    /**
     * Upserts every category in one transaction. A category whose path changed
     * drags its whole subtree along: descendants get the new path prefix and
     * their level shifted by the same amount, inside the same transaction.
     */
    @Override
    public void saveCategoriesBatch(List<Category> categories) {
        if (categories == null || categories.isEmpty())
            return;

        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement psSelect = conn.prepareStatement(SqlLoader.load("select-category"));
                    PreparedStatement psUpsert = conn.prepareStatement(SqlLoader.load("upsert-category"));
                    PreparedStatement psMove = conn.prepareStatement(SqlLoader.load("update-category-subtree-path"))) {
                for (Category c : categories) {
                    Category previous = findInTransaction(psSelect, c.id());
                    bindCategory(psUpsert, c);
                    psUpsert.executeUpdate();
                    if (previous != null && !previous.path().equals(c.path())) {
                        moveSubtree(psMove, previous, c);
                    }
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new CategoryQueryException("Failed to save " + categories.size() + " categories", e);
        }

        if (categories.size() > 1) {
            LOG.info("[DB] Batch saved {} categories.", categories.size());
        } else {
            LOG.debug("[DB] Saved/Updated category: {}", categories.get(0).id());
        }
    }

    private Category findInTransaction(PreparedStatement psSelect, int categoryId) throws SQLException {
        psSelect.setInt(1, categoryId);
        try (ResultSet rs = psSelect.executeQuery()) {
            return rs.next() ? mapCategory(rs) : null;
        }
    }

    /**
     * Rewrites {@code old.path/...} to {@code moved.path/...} for every
     * descendant of the moved category.
     *
     * @throws IllegalArgumentException if the category would move below itself
     */
    private void moveSubtree(PreparedStatement psMove, Category previous, Category moved) throws SQLException {
        if (moved.isDescendantOf(previous.path())) {
            throw new IllegalArgumentException("Category " + moved.id() + " cannot move below itself: "
                    + previous.path() + " -> " + moved.path());
        }
        psMove.setString(1, moved.path());
        psMove.setInt(2, previous.path().length() + 1);
        psMove.setInt(3, moved.level() - previous.level());
        psMove.setString(4, escapeLike(previous.path()) + Category.PATH_SEPARATOR + "%");
        int rewritten = psMove.executeUpdate();
        LOG.info("[DB] Moved category {} from {} to {} ({} descendants rewritten)",
                moved.id(), previous.path(), moved.path(), rewritten);
    }

    @Override
    public int deleteCategoryTree(int categoryId) {
        Category category;
        try {
            category = get(categoryId);
        } catch (CategoryNotFoundException e) {
            LOG.debug("[DB] Category {} already absent, nothing to delete.", categoryId);
            return 0;
        }

        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-category-tree"))) {
            bindSubtree(ps, category.path());
            int deleted = ps.executeUpdate();
            LOG.info("[DB] Deleted {} categories under {}", deleted, category.path());
            return deleted;
        } catch (SQLException e) {
            throw new CategoryQueryException("Failed to delete category tree " + categoryId, e);
        }
    }

    // =====================================================================
    // Binding & Mapping
    // =====================================================================

    private void bindCategory(PreparedStatement ps, Category c) throws SQLException {
        ps.setInt(1, c.id());
        ps.setInt(2, c.parentId());
        ps.setString(3, c.path());
        ps.setInt(4, c.position());
        ps.setInt(5, c.level());
        ps.setString(6, c.name());
    }

    /** Binds the exact path and the escaped {@code LIKE} pattern for its subtree. */
    private void bindSubtree(PreparedStatement ps, String prefix) throws SQLException {
        ps.setString(1, prefix);
        ps.setString(2, escapeLike(prefix) + Category.PATH_SEPARATOR + "%");
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private Category mapCategory(ResultSet rs) throws SQLException {
        return new Category(
                rs.getInt("entity_id"),
                rs.getInt("parent_id"),
                rs.getString("path"),
                rs.getInt("position"),
                rs.getInt("level"),
                rs.getString("name"));
    }
}
