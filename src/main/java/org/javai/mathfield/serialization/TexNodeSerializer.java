package org.javai.mathfield.serialization;

import org.javai.mathfield.tex.TexNode;

/**
 * Converts the persistent content of a {@link TexNode} tree to and from a document.
 *
 * <p>Only leaves, functions and the edit position of every node are persisted. The cursor
 * marker is never written, and reading a document never produces one: the caller decides
 * which node becomes active after loading.</p>
 */
public interface TexNodeSerializer {

	/**
	 * Serializes a tree. The tree is not modified, even if one of its nodes is active.
	 *
	 * @param root the root node
	 * @return the document
	 */
	String serialize(TexNode root);

	/**
	 * Reads a document back into a fresh, inactive tree.
	 *
	 * @param document the serialized document
	 * @return the root node
	 * @throws FormatException if the document is malformed; no partial tree is returned
	 */
	TexNode deserialize(String document);

	/**
	 * Thrown when a document cannot be read.
	 */
	class FormatException extends RuntimeException {
		public FormatException(String message) {
			super(message);
		}

		public FormatException(String message, Throwable cause) {
			super(message, cause);
		}
	}
}
