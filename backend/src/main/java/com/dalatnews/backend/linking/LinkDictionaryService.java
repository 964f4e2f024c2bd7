package com.dalatnews.backend.linking;

import com.dalatnews.backend.config.NewsPipelineProperties;
import com.dalatnews.backend.db.entity.CommunityEvent;
import com.dalatnews.backend.db.entity.Venue;
import com.dalatnews.backend.db.repository.CommunityEventRepository;
import com.dalatnews.backend.db.repository.VenueRepository;
import com.dalatnews.backend.model.dto.InternalLink;
import com.dalatnews.backend.model.enums.LinkType;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Builds the name → link dictionary from recent events, venues and well-known landmarks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LinkDictionaryService {

    static final String PUBLISHED = "published";

    static final List<String> LANDMARKS = List.of(
            "Hồ Xuân Hương",
            "Langbiang",
            "Chợ Đà Lạt",
            "Đường Nguyễn Văn Trỗi",
            "Quảng trường Lâm Viên"
    );
    static final String MAP_URL = "/map";

    private final CommunityEventRepository eventRepository;
    private final VenueRepository venueRepository;
    private final NewsPipelineProperties pipelineProperties;

    /**
     * Keys are lowercased entity names. A failing query is logged and contributes nothing.
     */
    public Map<String, InternalLink> buildLinkDictionary() {
        NewsPipelineProperties.Linking settings = pipelineProperties.getLinking();
        PageRequest limit = PageRequest.of(0, settings.getEntityLimit());
        Map<String, InternalLink> dictionary = new LinkedHashMap<>();

        try {
            OffsetDateTime from = OffsetDateTime.now(ZoneOffset.UTC).minusDays(settings.getEventLookbackDays());
            List<CommunityEvent> events =
                    eventRepository.findByStatusAndStartsAtGreaterThanEqual(PUBLISHED, from, limit);
            for (CommunityEvent event : events) {
                if (hasText(event.getTitle()) && hasText(event.getSlug())) {
                    put(dictionary, new InternalLink(event.getTitle(), "/events/" + event.getSlug(), LinkType.EVENT));
                }
            }
        } catch (RuntimeException e) {
            log.error("Failed to fetch events for link dictionary: {}", e.getMessage());
        }

        try {
            for (Venue venue : venueRepository.findAll(limit)) {
                if (hasText(venue.getName()) && hasText(venue.getSlug())) {
                    put(dictionary, new InternalLink(venue.getName(), "/venues/" + venue.getSlug(), LinkType.VENUE));
                }
            }
        } catch (RuntimeException e) {
            log.error("Failed to fetch venues for link dictionary: {}", e.getMessage());
        }

        for (String landmark : LANDMARKS) {
            put(dictionary, new InternalLink(landmark, MAP_URL, LinkType.LOCATION));
        }

        log.info("Built link dictionary with {} entries", dictionary.size());
        return dictionary;
    }

    private static void put(Map<String, InternalLink> dictionary, InternalLink link) {
        dictionary.put(link.getText().toLowerCase(Locale.ROOT), link);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
