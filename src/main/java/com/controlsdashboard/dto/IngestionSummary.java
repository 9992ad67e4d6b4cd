package com.controlsdashboard.dto;

/**
 * Counts from one catalog normalization run. "Written" counts exclude rows the store already held.
 */
public class IngestionSummary {

    private String source;
    private int groups;
    private int controlsExtracted;
    private int controlsWritten;
    private int controlsSkipped;
    private int parametersWritten;
    private int partsWritten;
    private int propsWritten;
    private int linksWritten;
    private int relationsWritten;
    private int familiesWritten;
    private int resourcesUpserted;

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public int getGroups() {
        return groups;
    }

    public int getControlsExtracted() {
        return controlsExtracted;
    }

    public int getControlsWritten() {
        return controlsWritten;
    }

    public int getControlsSkipped() {
        return controlsSkipped;
    }

    public int getParametersWritten() {
        return parametersWritten;
    }

    public int getPartsWritten() {
        return partsWritten;
    }

    public int getPropsWritten() {
        return propsWritten;
    }

    public int getLinksWritten() {
        return linksWritten;
    }

    public int getRelationsWritten() {
        return relationsWritten;
    }

    public int getFamiliesWritten() {
        return familiesWritten;
    }

    public int getResourcesUpserted() {
        return resourcesUpserted;
    }

    public void incrementGroups() { groups++; }
    public void incrementControlsExtracted() { controlsExtracted++; }
    public void incrementControlsSkipped() { controlsSkipped++; }
    public void countControlWritten(boolean written) { if (written) controlsWritten++; }
    public void countParameterWritten(boolean written) { if (written) parametersWritten++; }
    public void countPartWritten(boolean written) { if (written) partsWritten++; }
    public void countPropWritten(boolean written) { if (written) propsWritten++; }
    public void countLinkWritten(boolean written) { if (written) linksWritten++; }
    public void countRelationWritten(boolean written) { if (written) relationsWritten++; }
    public void countFamilyWritten(boolean written) { if (written) familiesWritten++; }
    public void incrementResourcesUpserted() { resourcesUpserted++; }

    @Override
    public String toString() {
        return "IngestionSummary{source=" + source
                + ", groups=" + groups
                + ", controls=" + controlsWritten + "/" + controlsExtracted
                + ", skipped=" + controlsSkipped
                + ", parameters=" + parametersWritten
                + ", parts=" + partsWritten
                + ", props=" + propsWritten
                + ", links=" + linksWritten
                + ", relations=" + relationsWritten
                + ", families=" + familiesWritten
                + ", resources=" + resourcesUpserted + "}";
    }
}
