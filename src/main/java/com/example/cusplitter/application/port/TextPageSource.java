package com.example.cusplitter.application.port;

import com.example.cusplitter.domain.model.PageText;

/**
 * Read access to the per-page text of the bulk document.
 * Implementations throw an unchecked exception when a page cannot be read; the split is then
 * abandoned as a whole.
 */
public interface TextPageSource {

    int pageCount();

    /**
     * @param index 0-based page index
     * @return page text, empty when the page has no text layer
     */
    PageText pageText(int index);
}
