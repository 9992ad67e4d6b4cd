package com.controlsdashboard.service;

/**
 * How far below a control satellite elements (parts, props, links) are collected.
 */
public enum TraversalScope {
    /** Immediate children of the control element only. */
    DIRECT_CHILDREN,
    /** Anywhere below the control, without entering nested controls. */
    OWN_SUBTREE,
    /** Anywhere below the control, nested controls included. */
    ALL_DESCENDANTS
}
