package net.bibrecords.repository;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.bibrecords.model.Publication;
import net.bibrecords.util.PublicationPostProcessor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * JDBC access to the {@code publications} table.
 *
 * <p>Every loaded row is passed through {@link PublicationPostProcessor}, so callers always see
 * normalized author views. Two orderings are exposed and must not be unified:
 * <ul>
 *   <li>display order: year, month, id descending ({@link #findAllInDisplayOrder()})</li>
 *   <li>citation-key order: month, id ascending ({@link #findCiteKeyCandidates(Integer, String)})</li>
 * </ul>
 */
@Repository
@Slf4j
public class PublicationRepository {

    private static final String SELECT_COLUMNS = """
        SELECT id, publication_type, citekey, title, authors, publication_year, publication_month,
               journal, book_title, publisher, institution, volume, issue_number, edition, location,
               series, pages, note, keywords, url, urldate, code, doi, is_external, abstract_text,
               isbn, issn
        FROM publications
        """;

    private static final String INSERT_SQL = """
        INSERT INTO publications (
            publication_type, citekey, title, authors, publication_year, publication_month,
            journal, book_title, publisher, institution, volume, issue_number, edition, location,
            series, pages, note, keywords, url, urldate, code, doi, is_external, abstract_text,
            isbn, issn
        )
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String UPDATE_SQL = """
        UPDATE publications SET
            publication_type = ?, citekey = ?, title = ?, authors = ?, publication_year = ?,
            publication_month = ?, journal = ?, book_title = ?, publisher = ?, institution = ?,
            volume = ?, issue_number = ?, edition = ?, location = ?, series = ?, pages = ?, note = ?,
            keywords = ?, url = ?, urldate = ?, code = ?, doi = ?, is_external = ?, abstract_text = ?,
            isbn = ?, issn = ?
        WHERE id = ?
        """;

    private static final int UPDATE_ID_INDEX = 27;

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<Publication> rowMapper = (rs, rowNum) -> mapRow(rs);

    public PublicationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts a new row and returns its generated id.
     *
     * @throws org.springframework.dao.DuplicateKeyException when the citation key is already taken
     */
    public long insert(Publication publication) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = prepareWithGeneratedId(connection);
            bindColumns(ps, publication);
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Insert into publications returned no generated id");
        }
        log.debug("Inserted publication id={} citekey='{}'", key, publication.getCitekey());
        return key.longValue();
    }

    /**
     * Overwrites all columns of an existing row.
     *
     * @return whether a row with the publication's id existed
     * @throws org.springframework.dao.DuplicateKeyException when the citation key is already taken
     */
    public boolean update(Publication publication) {
        if (publication.getId() == null) {
            throw new IllegalArgumentException("Cannot update a publication without id");
        }
        int updated = jdbcTemplate.update(UPDATE_SQL, ps -> {
            bindColumns(ps, publication);
            ps.setLong(UPDATE_ID_INDEX, publication.getId());
        });
        return updated > 0;
    }

    public Optional<Publication> findById(long id) {
        List<Publication> rows = jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", rowMapper, id);
        return rows.stream().findFirst();
    }

    public Optional<Publication> findByCitekey(String citekey) {
        if (citekey == null || citekey.isBlank()) {
            return Optional.empty();
        }
        List<Publication> rows = jdbcTemplate.query(SELECT_COLUMNS + " WHERE citekey = ?", rowMapper, citekey);
        return rows.stream().findFirst();
    }

    /**
     * Lists all publications newest first: year, month and id descending, unknown dates first.
     */
    public List<Publication> findAllInDisplayOrder() {
        return jdbcTemplate.query(
            SELECT_COLUMNS + " ORDER BY publication_year DESC NULLS FIRST, publication_month DESC NULLS FIRST, id DESC",
            rowMapper
        );
    }

    /**
     * Fetches the publications competing for a citation key prefix: same year, authors text containing
     * the surname (case-insensitive), ordered by month then id ascending with unknown months last.
     */
    public List<Publication> findCiteKeyCandidates(Integer year, String surname) {
        String pattern = "%" + escapeLike(surname.toLowerCase(Locale.ROOT)) + "%";
        String yearClause = year != null ? "publication_year = ?" : "publication_year IS NULL";
        String sql = SELECT_COLUMNS
            + " WHERE " + yearClause + " AND LOWER(authors) LIKE ? ESCAPE '\\'"
            + " ORDER BY publication_month ASC NULLS LAST, id ASC";

        try {
            if (year != null) {
                return jdbcTemplate.query(sql, rowMapper, year, pattern);
            }
            return jdbcTemplate.query(sql, rowMapper, pattern);
        } catch (DataAccessException exception) {
            log.error("Failed to load citation key candidates for surname '{}' and year {}: {}",
                surname, year, exception.getMessage(), exception);
            throw exception;
        }
    }

    private PreparedStatement prepareWithGeneratedId(Connection connection) throws SQLException {
        return connection.prepareStatement(INSERT_SQL, new String[] {"id"});
    }

    private static void bindColumns(PreparedStatement ps, Publication publication) throws SQLException {
        ps.setString(1, publication.getType() != null ? publication.getType() : Publication.DEFAULT_TYPE);
        ps.setString(2, publication.getCitekey());
        ps.setString(3, publication.getTitle());
        ps.setString(4, publication.getAuthors());
        setNullableInt(ps, 5, publication.getYear());
        setNullableInt(ps, 6, publication.getMonth());
        ps.setString(7, nullToEmpty(publication.getJournal()));
        ps.setString(8, nullToEmpty(publication.getBookTitle()));
        ps.setString(9, nullToEmpty(publication.getPublisher()));
        ps.setString(10, nullToEmpty(publication.getInstitution()));
        setNullableInt(ps, 11, publication.getVolume());
        setNullableInt(ps, 12, publication.getNumber());
        ps.setString(13, nullToEmpty(publication.getEdition()));
        ps.setString(14, nullToEmpty(publication.getLocation()));
        ps.setString(15, nullToEmpty(publication.getSeries()));
        ps.setString(16, nullToEmpty(publication.getPages()));
        ps.setString(17, nullToEmpty(publication.getNote()));
        ps.setString(18, nullToEmpty(publication.getKeywords()));
        ps.setString(19, nullToEmpty(publication.getUrl()));
        if (publication.getUrldate() != null) {
            ps.setDate(20, Date.valueOf(publication.getUrldate()));
        } else {
            ps.setNull(20, Types.DATE);
        }
        ps.setString(21, nullToEmpty(publication.getCode()));
        ps.setString(22, nullToEmpty(publication.getDoi()));
        ps.setBoolean(23, publication.isExternal());
        ps.setString(24, nullToEmpty(publication.getAbstractText()));
        ps.setString(25, nullToEmpty(publication.getIsbn()));
        ps.setString(26, nullToEmpty(publication.getIssn()));
    }

    private static Publication mapRow(ResultSet rs) throws SQLException {
        Publication publication = new Publication();
        publication.setId(rs.getLong("id"));
        publication.setType(rs.getString("publication_type"));
        publication.setCitekey(rs.getString("citekey"));
        publication.setTitle(rs.getString("title"));
        publication.setAuthors(rs.getString("authors"));
        publication.setYear(getNullableInt(rs, "publication_year"));
        publication.setMonth(getNullableInt(rs, "publication_month"));
        publication.setJournal(rs.getString("journal"));
        publication.setBookTitle(rs.getString("book_title"));
        publication.setPublisher(rs.getString("publisher"));
        publication.setInstitution(rs.getString("institution"));
        publication.setVolume(getNullableInt(rs, "volume"));
        publication.setNumber(getNullableInt(rs, "issue_number"));
        publication.setEdition(rs.getString("edition"));
        publication.setLocation(rs.getString("location"));
        publication.setSeries(rs.getString("series"));
        publication.setPages(rs.getString("pages"));
        publication.setNote(rs.getString("note"));
        publication.setKeywords(rs.getString("keywords"));
        publication.setUrl(rs.getString("url"));
        Date urldate = rs.getDate("urldate");
        publication.setUrldate(urldate != null ? urldate.toLocalDate() : null);
        publication.setCode(rs.getString("code"));
        publication.setDoi(rs.getString("doi"));
        publication.setExternal(rs.getBoolean("is_external"));
        publication.setAbstractText(rs.getString("abstract_text"));
        publication.setIsbn(rs.getString("isbn"));
        publication.setIssn(rs.getString("issn"));
        return PublicationPostProcessor.postProcess(publication);
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
