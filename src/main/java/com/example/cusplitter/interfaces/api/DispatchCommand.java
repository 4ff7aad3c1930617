package com.example.cusplitter.interfaces.api;

import java.util.Map;

/**
 * Body of a dispatch request.
 *
 * @param subject     subject template, blank for the configured default
 * @param body        HTML body template, blank for the configured default
 * @param resolutions certificate number to the fiscal code or email of the chosen ambiguous candidate
 * @param emails      certificate number to an address typed by the operator, for matched recipients
 *                    the roster has no email for and for unmatched certificates
 */
public record DispatchCommand(String subject, String body, Map<Integer, String> resolutions, Map<Integer, String> emails) {
}
