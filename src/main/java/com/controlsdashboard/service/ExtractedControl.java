package com.controlsdashboard.service;

import com.controlsdashboard.model.Control;
import com.controlsdashboard.model.ControlRelation;
import com.controlsdashboard.model.Link;
import com.controlsdashboard.model.Part;
import com.controlsdashboard.model.Prop;

import java.util.List;

/**
 * A normalized control and the satellite rows extracted alongside it.
 */
public record ExtractedControl(
        Control control,
        List<Part> parts,
        List<Prop> props,
        List<Link> links,
        List<ControlRelation> relations
) {
}
