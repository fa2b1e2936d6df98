package com.dcruver.litsync.library;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the Zotero desktop database ({@code zotero.sqlite}) without modifying it.
 * <p>
 * Only the configured item types are listed and trashed items are ignored. Collection
 * paths are built from the parent chain of each collection. Attachments stored by Zotero
 * are referenced as {@code storage/<attachmentKey>/<file>} relative to the data directory;
 * linked files keep their absolute path.
 */
@Slf4j
public class ZoteroSqliteLibraryClient implements LibraryClient {

    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");
    private static final String STORAGE_PREFIX = "storage:";

    private static final String ITEMS_SQL = """
        SELECT i.itemID, i.key, t.typeName
        FROM items i
        JOIN itemTypes t ON i.itemTypeID = t.itemTypeID
        WHERE t.typeName IN (:types)
          AND i.itemID NOT IN (SELECT itemID FROM deletedItems)
        """;

    private static final String FIELDS_SQL = """
        SELECT d.itemID, f.fieldName, v.value
        FROM itemData d
        JOIN fields f ON d.fieldID = f.fieldID
        JOIN itemDataValues v ON d.valueID = v.valueID
        """;

    private static final String CREATORS_SQL = """
        SELECT ic.itemID, c.firstName, c.lastName, ct.creatorType
        FROM itemCreators ic
        JOIN creators c ON ic.creatorID = c.creatorID
        JOIN creatorTypes ct ON ic.creatorTypeID = ct.creatorTypeID
        ORDER BY ic.itemID, ic.orderIndex
        """;

    private static final String TAGS_SQL = """
        SELECT it.itemID, t.name
        FROM itemTags it
        JOIN tags t ON it.tagID = t.tagID
        ORDER BY t.name
        """;

    private static final String COLLECTIONS_SQL =
        "SELECT collectionID, collectionName, parentCollectionID FROM collections";

    private static final String COLLECTION_ITEMS_SQL =
        "SELECT collectionID, itemID FROM collectionItems";

    private static final String ATTACHMENTS_SQL = """
        SELECT a.parentItemID, i.key, a.path, a.contentType
        FROM itemAttachments a
        JOIN items i ON a.itemID = i.itemID
        WHERE a.parentItemID IS NOT NULL
          AND a.itemID NOT IN (SELECT itemID FROM deletedItems)
        ORDER BY a.itemID
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final Path zoteroDir;
    private final List<String> itemTypes;

    public ZoteroSqliteLibraryClient(NamedParameterJdbcTemplate jdbc, Path zoteroDir, List<String> itemTypes) {
        this.jdbc = jdbc;
        this.zoteroDir = zoteroDir;
        this.itemTypes = List.copyOf(itemTypes);
    }

    @Override
    public List<LibraryItem> listItems(String collectionFilter) {
        List<LibraryItem> items = loadItems();
        if (collectionFilter == null || collectionFilter.isBlank()) {
            return items;
        }
        List<LibraryItem> filtered = items.stream().filter(i -> i.matchesFilter(collectionFilter)).toList();
        log.info("{} of {} items match collection filter '{}'", filtered.size(), items.size(), collectionFilter);
        return filtered;
    }

    @Override
    public Map<CollectionPath, Integer> listCollections() {
        Map<CollectionPath, Integer> counts = new TreeMap<>();
        for (CollectionPath path : buildCollectionPaths().values()) {
            counts.put(path, 0);
        }
        for (LibraryItem item : loadItems()) {
            for (CollectionPath path : item.getCollectionPaths()) {
                counts.merge(path, 1, Integer::sum);
            }
        }
        return counts;
    }

    @Override
    public Optional<byte[]> fetchAttachment(String attachmentRef) {
        if (attachmentRef == null || attachmentRef.isBlank()) {
            return Optional.empty();
        }
        Path file = resolveAttachment(attachmentRef);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new LibraryClientException("Cannot read attachment " + file, e);
        }
    }

    Path resolveAttachment(String attachmentRef) {
        Path path = Path.of(attachmentRef);
        return path.isAbsolute() ? path : zoteroDir.resolve(path).normalize();
    }

    private List<LibraryItem> loadItems() {
        try {
            Map<Long, String[]> rows = new LinkedHashMap<>();
            jdbc.query(ITEMS_SQL, new MapSqlParameterSource("types", itemTypes), rs -> {
                rows.put(rs.getLong("itemID"), new String[]{rs.getString("key"), rs.getString("typeName")});
            });

            Map<Long, Map<String, String>> fields = new HashMap<>();
            jdbc.getJdbcTemplate().query(FIELDS_SQL, rs -> {
                long itemId = rs.getLong("itemID");
                if (rows.containsKey(itemId)) {
                    fields.computeIfAbsent(itemId, k -> new LinkedHashMap<>())
                        .put(rs.getString("fieldName"), rs.getString("value"));
                }
            });

            Map<Long, List<String>> authors = new HashMap<>();
            jdbc.getJdbcTemplate().query(CREATORS_SQL, rs -> {
                long itemId = rs.getLong("itemID");
                if (rows.containsKey(itemId) && "author".equals(rs.getString("creatorType"))) {
                    String name = formatAuthor(rs.getString("firstName"), rs.getString("lastName"));
                    if (name != null) {
                        authors.computeIfAbsent(itemId, k -> new ArrayList<>()).add(name);
                    }
                }
            });

            Map<Long, List<String>> tags = new HashMap<>();
            jdbc.getJdbcTemplate().query(TAGS_SQL, rs -> {
                long itemId = rs.getLong("itemID");
                if (rows.containsKey(itemId)) {
                    tags.computeIfAbsent(itemId, k -> new ArrayList<>()).add(rs.getString("name"));
                }
            });

            Map<Long, CollectionPath> collectionPaths = buildCollectionPaths();
            Map<Long, Set<CollectionPath>> itemCollections = new HashMap<>();
            jdbc.getJdbcTemplate().query(COLLECTION_ITEMS_SQL, rs -> {
                CollectionPath path = collectionPaths.get(rs.getLong("collectionID"));
                long itemId = rs.getLong("itemID");
                if (path != null && rows.containsKey(itemId)) {
                    itemCollections.computeIfAbsent(itemId, k -> new LinkedHashSet<>()).add(path);
                }
            });

            // First PDF wins over any other attachment type
            Map<Long, String> attachments = new HashMap<>();
            Set<Long> withPdf = new HashSet<>();
            jdbc.getJdbcTemplate().query(ATTACHMENTS_SQL, rs -> {
                long parentId = rs.getLong("parentItemID");
                if (!rows.containsKey(parentId)) {
                    return;
                }
                String ref = attachmentRef(rs.getString("key"), rs.getString("path"));
                if (ref == null) {
                    return;
                }
                if ("application/pdf".equals(rs.getString("contentType"))) {
                    if (withPdf.add(parentId)) {
                        attachments.put(parentId, ref);
                    }
                } else {
                    attachments.putIfAbsent(parentId, ref);
                }
            });

            List<LibraryItem> items = new ArrayList<>();
            for (Map.Entry<Long, String[]> row : rows.entrySet()) {
                long itemId = row.getKey();
                LibraryItem item = buildItem(row.getValue()[0], row.getValue()[1],
                    fields.getOrDefault(itemId, Map.of()),
                    authors.getOrDefault(itemId, List.of()),
                    tags.getOrDefault(itemId, List.of()),
                    itemCollections.getOrDefault(itemId, Set.of()),
                    attachments.get(itemId));
                if (item != null) {
                    items.add(item);
                }
            }
            log.info("Loaded {} items from Zotero", items.size());
            return items;
        } catch (DataAccessException e) {
            throw new LibraryClientException("Cannot read Zotero database in " + zoteroDir + ": " + e.getMessage(), e);
        }
    }

    private LibraryItem buildItem(String key, String itemType, Map<String, String> fields, List<String> authors,
                                  List<String> tags, Set<CollectionPath> collections, String attachmentRef) {
        if (key == null || key.isBlank()) {
            log.warn("Skipping Zotero item without a key");
            return null;
        }

        Map<String, String> extra = new LinkedHashMap<>();
        extra.put("itemType", itemType);
        Set<String> known = Set.of("title", "abstractNote", "publicationTitle", "proceedingsTitle",
            "repository", "date", "DOI");
        fields.forEach((name, value) -> {
            if (!known.contains(name) && value != null && !value.isBlank()) {
                extra.put(name, value);
            }
        });

        String title = fields.get("title");
        String publication = firstNonBlank(fields.get("publicationTitle"), fields.get("proceedingsTitle"),
            fields.get("repository"));

        return LibraryItem.builder()
            .key(key)
            .title(title == null || title.isBlank() ? "Untitled" : title.trim())
            .authors(List.copyOf(authors))
            .year(extractYear(fields.get("date")))
            .abstractNote(fields.getOrDefault("abstractNote", ""))
            .publicationTitle(publication != null ? publication : "")
            .doi(fields.get("DOI"))
            .tags(List.copyOf(tags))
            .collectionPaths(collections.isEmpty() ? Set.of(CollectionPath.UNCATEGORIZED) : Set.copyOf(collections))
            .attachmentRef(attachmentRef)
            .extra(extra)
            .build();
    }

    private Map<Long, CollectionPath> buildCollectionPaths() {
        Map<Long, String> names = new HashMap<>();
        Map<Long, Long> parents = new HashMap<>();
        jdbc.getJdbcTemplate().query(COLLECTIONS_SQL, rs -> {
            long id = rs.getLong("collectionID");
            names.put(id, rs.getString("collectionName"));
            long parent = rs.getLong("parentCollectionID");
            if (!rs.wasNull()) {
                parents.put(id, parent);
            }
        });

        Map<Long, CollectionPath> paths = new HashMap<>();
        for (Long id : names.keySet()) {
            List<String> segments = new ArrayList<>();
            Set<Long> visited = new HashSet<>();
            Long current = id;
            while (current != null && names.containsKey(current) && visited.add(current)) {
                segments.add(0, names.get(current));
                current = parents.get(current);
            }
            paths.put(id, CollectionPath.of(segments));
        }
        return paths;
    }

    static String attachmentRef(String attachmentKey, String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        if (path.startsWith(STORAGE_PREFIX)) {
            return "storage/" + attachmentKey + "/" + path.substring(STORAGE_PREFIX.length());
        }
        if (Path.of(path).isAbsolute()) {
            return path;
        }
        return null;
    }

    static String formatAuthor(String firstName, String lastName) {
        boolean hasFirst = firstName != null && !firstName.isBlank();
        boolean hasLast = lastName != null && !lastName.isBlank();
        if (hasLast && hasFirst) {
            return lastName.trim() + ", " + firstName.trim();
        }
        if (hasLast) {
            return lastName.trim();
        }
        return hasFirst ? firstName.trim() : null;
    }

    static String extractYear(String date) {
        if (date == null || date.isBlank()) {
            return "";
        }
        Matcher matcher = YEAR.matcher(date);
        return matcher.find() ? matcher.group() : date.trim();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
