/**
 * DocumentUris.java
 *
 * Response body of the metadata endpoint: where the shared document lives and
 * which directory the language server treats as its project root.
 */
package club.ppmc.leanedit.model;

/**
 * @param fileUri absolute {@code file://} URI of the mirrored document.
 * @param rootUri absolute {@code file://} URI of the Lean project directory.
 */
public record DocumentUris(String fileUri, String rootUri) {}
