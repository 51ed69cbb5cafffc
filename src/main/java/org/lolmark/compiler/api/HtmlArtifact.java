package org.lolmark.compiler.api;

/**
 * The result of a successful compilation.
 *
 * @param programName The name the source was compiled under.
 * @param html The complete HTML document.
 */
public record HtmlArtifact(String programName, String html) {
}
