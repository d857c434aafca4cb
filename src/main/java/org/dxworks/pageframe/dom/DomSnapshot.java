package org.dxworks.pageframe.dom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * A whole page: its element tree plus the page-level script and stylesheet
 * sources that never enter the tree. External resources are listed by URL.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DomSnapshot {
    public String url;
    public String title;
    public DomNode root;
    public List<String> scripts = new ArrayList<>();
    public List<String> stylesheets = new ArrayList<>();

    public DomSnapshot() {
    }

    public DomSnapshot(DomNode root) {
        this.root = root;
    }
}
