package linkguard.core.service.link;

import linkguard.core.model.link.LinkRecord;

/**
 * Result of a shorten request.
 *
 * @param link the link
 * @param reused true if an existing active link for the same URL was returned
 */
public record CreatedLink(LinkRecord link, boolean reused) {}
