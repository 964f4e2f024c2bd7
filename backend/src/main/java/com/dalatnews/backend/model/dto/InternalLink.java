package com.dalatnews.backend.model.dto;

import com.dalatnews.backend.model.enums.LinkType;
import lombok.Value;

/**
 * A hyperlink to another page on the platform: an event, a venue or a map location.
 */
@Value
public class InternalLink {
    String text;
    String url;
    LinkType type;

    public String toMarkdown() {
        return "[" + text + "](" + url + ")";
    }
}
