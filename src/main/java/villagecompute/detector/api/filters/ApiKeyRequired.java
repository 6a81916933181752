package villagecompute.detector.api.filters;

import jakarta.ws.rs.NameBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * JAX-RS name binding annotation for {@code X-API-Key} header enforcement.
 *
 * <p>
 * <b>Usage Example:</b>
 *
 * <pre>
 * &#64;POST
 * &#64;Path("/detect-country")
 * &#64;ApiKeyRequired
 * public Response detectCountry(DetectionRequestType request) {
 *     // Implementation
 * }
 * </pre>
 *
 * @see ApiKeyFilter for enforcement implementation
 */
@NameBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface ApiKeyRequired {
}
