package com.example.cusplitter.domain.model;

/**
 * Plain text of one page of the source document.
 *
 * @param index 0-based page index
 * @param text  extracted text, empty when the page carries no text layer
 */
public record PageText(int index, String text) {

    public PageText {
        if (index < 0) {
            throw new IllegalArgumentException("Page index must not be negative: " + index);
        }
        text = text == null ? "" : text;
    }
}
