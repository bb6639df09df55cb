package linkguard.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import linkguard.core.model.link.LinkRecord;
import linkguard.core.model.link.VisitRecord;
import linkguard.core.port.out.LinkRepository;

/**
 * In-memory LinkRepository.
 *
 * <p>State is lost on restart. Suitable for development, tests and
 * single-instance deployments that do not need durable links.
 */
public class InMemoryLinkRepository implements LinkRepository {

    private final ConcurrentMap<String, LinkRecord> linksByCode = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> codesByUrl = new ConcurrentHashMap<>();
    private final List<VisitRecord> visits = Collections.synchronizedList(new ArrayList<>());

    @Override
    public Uni<Optional<LinkRecord>> findByShortCode(String shortCode) {
        return Uni.createFrom().item(() -> Optional.ofNullable(linksByCode.get(shortCode)));
    }

    @Override
    public Uni<Optional<LinkRecord>> findByOriginalUrl(String originalUrl) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(codesByUrl.get(originalUrl)).map(linksByCode::get));
    }

    @Override
    public Multi<String> streamAllShortCodes() {
        return Multi.createFrom().items(() -> List.copyOf(linksByCode.keySet()).stream());
    }

    @Override
    public Uni<LinkRecord> save(LinkRecord link) {
        return Uni.createFrom().item(() -> {
            linksByCode.put(link.shortCode(), link);
            codesByUrl.put(link.originalUrl(), link.shortCode());
            return link;
        });
    }

    @Override
    public Uni<Void> incrementVisitCount(String shortCode) {
        return Uni.createFrom().item(() -> {
            linksByCode.computeIfPresent(shortCode, (code, link) -> link.withVisitCount(link.visitCount() + 1));
            return null;
        });
    }

    @Override
    public Uni<Void> saveVisit(VisitRecord visit) {
        return Uni.createFrom().item(() -> {
            visits.add(visit);
            return null;
        });
    }

    /**
     * Returns a snapshot of recorded visits for a short code.
     *
     * @param shortCode the short code
     * @return the visits, oldest first
     */
    public List<VisitRecord> visitsFor(String shortCode) {
        synchronized (visits) {
            return visits.stream().filter(v -> v.shortCode().equals(shortCode)).toList();
        }
    }
}
