package com.controlsdashboard.dto;

import com.controlsdashboard.model.Control;
import com.controlsdashboard.model.Link;
import com.controlsdashboard.model.Parameter;
import com.controlsdashboard.model.Part;
import com.controlsdashboard.model.Prop;

import java.util.List;

/**
 * Payload returned by /api/controls/{id}.
 */
public record ControlView(
        Control control,
        List<Parameter> parameters,
        List<Part> parts,
        List<Prop> props,
        List<Link> links,
        List<String> childControlIds
) {}
