package com.aqlcomposer.query;

/**
 * Array comparison quantifiers (e.g. {@code a.emails ANY LIKE "%gmail.com"})
 */
public enum ArrayQuantifier {
    ALL,
    ANY,
    NONE
}
