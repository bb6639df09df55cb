package linkguard.core.service.link;

/**
 * Source of candidate short codes.
 */
@FunctionalInterface
public interface ShortCodeGenerator {

    String nextCode();
}
