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
import org.springframework.stereotype.Repository;

/**
 * {@link CatalogStore} over the Spring Data repositories, using PostgreSQL {@code ON CONFLICT} inserts.
 */
@Repository
public class JpaCatalogStore implements CatalogStore {

    private final ControlRepository controlRepository;
    private final ParameterRepository parameterRepository;
    private final PartRepository partRepository;
    private final PropRepository propRepository;
    private final LinkRepository linkRepository;
    private final ControlRelationRepository controlRelationRepository;
    private final ControlFamilyRepository controlFamilyRepository;
    private final ResourceRepository resourceRepository;
    private final BaselineRepository baselineRepository;
    private final BaselineControlRepository baselineControlRepository;

    public JpaCatalogStore(ControlRepository controlRepository,
                           ParameterRepository parameterRepository,
                           PartRepository partRepository,
                           PropRepository propRepository,
                           LinkRepository linkRepository,
                           ControlRelationRepository controlRelationRepository,
                           ControlFamilyRepository controlFamilyRepository,
                           ResourceRepository resourceRepository,
                           BaselineRepository baselineRepository,
                           BaselineControlRepository baselineControlRepository) {
        this.controlRepository = controlRepository;
        this.parameterRepository = parameterRepository;
        this.partRepository = partRepository;
        this.propRepository = propRepository;
        this.linkRepository = linkRepository;
        this.controlRelationRepository = controlRelationRepository;
        this.controlFamilyRepository = controlFamilyRepository;
        this.resourceRepository = resourceRepository;
        this.baselineRepository = baselineRepository;
        this.baselineControlRepository = baselineControlRepository;
    }

    @Override
    public boolean insertControl(Control c) {
        return controlRepository.insertIgnore(c.getControlId(), c.getCatalogId(), c.getControlClass(),
                c.getTitle(), c.getLabel(), c.getStatement()) > 0;
    }

    @Override
    public boolean insertParameter(Parameter p) {
        return parameterRepository.insertIgnore(p.getParameterId(), p.getControlId(), p.getLabel(), p.getGuideline()) > 0;
    }

    @Override
    public boolean insertPart(Part p) {
        return partRepository.insertIgnore(p.getPartId(), p.getControlId(), p.getName(), p.getProse(), p.getOrder()) > 0;
    }

    @Override
    public boolean insertProp(Prop p) {
        return propRepository.insertIgnore(p.getPropId(), p.getControlId(), p.getName(), p.getValue(), p.getNs()) > 0;
    }

    @Override
    public boolean insertLink(Link l) {
        return linkRepository.insertIgnore(l.getLinkId(), l.getControlId(), l.getHref(), l.getRel(), l.getMediaType()) > 0;
    }

    @Override
    public boolean insertRelation(ControlRelation r) {
        return controlRelationRepository.insertIgnore(r.getParentControlId(), r.getChildControlId()) > 0;
    }

    @Override
    public boolean insertFamily(ControlFamily f) {
        return controlFamilyRepository.insertIgnore(f.getFamilyCode(), f.getFamilyName(), f.getDescription()) > 0;
    }

    @Override
    public void upsertResource(Resource r) {
        resourceRepository.upsert(r.getUuid(), r.getTitle(), r.getLocation(), r.getCitation());
    }

    @Override
    public Integer insertBaseline(Baseline baseline) {
        // IDENTITY generation: the insert is issued immediately and the key read back
        return baselineRepository.saveAndFlush(baseline).getBaselineId();
    }

    @Override
    public boolean insertBaselineControl(BaselineControl bc) {
        return baselineControlRepository.insertIgnore(bc.getBaselineId(), bc.getControlId()) > 0;
    }
}
