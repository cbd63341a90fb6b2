/**
 * Webmention sending and receiving.
 *
 * <p>{@link webmention.Webmentions} is the entry point; {@link webmention.WebmentionsConfig}
 * carries its options. Rejections surface as {@link webmention.InvalidMentionException},
 * retryable network problems as {@link webmention.ResolutionFailedException}.
 */
package webmention;
