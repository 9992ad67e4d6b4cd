package com.controlsdashboard.repository;

import com.controlsdashboard.model.Baseline;
import com.controlsdashboard.model.BaselineControl;
import com.controlsdashboard.model.Control;
import com.controlsdashboard.model.ControlFamily;
import com.controlsdashboard.model.ControlRelation;
import com.controlsdashboard.model.Link;
import com.controlsdashboard.model.Parameter;
import com.controlsdashboard.model.Part;
import com.controlsdashboard.model.Prop;
import com.controlsdashboard.model.Resource;

/**
 * Write side of the normalized catalog tables.
 *
 * <p>{@code insert*} methods are insert-or-ignore on the table's primary key and return whether a
 * row was written. Callers run inside one transaction per document.
 */
public interface CatalogStore {

    boolean insertControl(Control control);

    boolean insertParameter(Parameter parameter);

    boolean insertPart(Part part);

    boolean insertProp(Prop prop);

    boolean insertLink(Link link);

    boolean insertRelation(ControlRelation relation);

    boolean insertFamily(ControlFamily family);

    /**
     * Inserts or overwrites a resource by uuid.
     */
    void upsertResource(Resource resource);

    /**
     * Inserts a new baseline row.
     *
     * @return the generated baseline id
     */
    Integer insertBaseline(Baseline baseline);

    boolean insertBaselineControl(BaselineControl baselineControl);
}
