package com.controlsdashboard.service;

import com.controlsdashboard.dto.ControlView;
import com.controlsdashboard.model.BaselineControl;
import com.controlsdashboard.model.ControlFamily;
import com.controlsdashboard.model.ControlRelation;
import com.controlsdashboard.repository.BaselineControlRepository;
import com.controlsdashboard.repository.ControlFamilyRepository;
import com.controlsdashboard.repository.ControlRelationRepository;
import com.controlsdashboard.repository.ControlRepository;
import com.controlsdashboard.repository.LinkRepository;
import com.controlsdashboard.repository.ParameterRepository;
import com.controlsdashboard.repository.PartRepository;
import com.controlsdashboard.repository.PropRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class CatalogReadService {

    private final ControlRepository controlRepository;
    private final ParameterRepository parameterRepository;
    private final PartRepository partRepository;
    private final PropRepository propRepository;
    private final LinkRepository linkRepository;
    private final ControlRelationRepository controlRelationRepository;
    private final ControlFamilyRepository controlFamilyRepository;
    private final BaselineControlRepository baselineControlRepository;

    public CatalogReadService(ControlRepository controlRepository,
                              ParameterRepository parameterRepository,
                              PartRepository partRepository,
                              PropRepository propRepository,
                              LinkRepository linkRepository,
                              ControlRelationRepository controlRelationRepository,
                              ControlFamilyRepository controlFamilyRepository,
                              BaselineControlRepository baselineControlRepository) {
        this.controlRepository = controlRepository;
        this.parameterRepository = parameterRepository;
        this.partRepository = partRepository;
        this.propRepository = propRepository;
        this.linkRepository = linkRepository;
        this.controlRelationRepository = controlRelationRepository;
        this.controlFamilyRepository = controlFamilyRepository;
        this.baselineControlRepository = baselineControlRepository;
    }

    /**
     * Loads a control with its parameters, satellites and nested control ids.
     */
    @Transactional(readOnly = true)
    public Optional<ControlView> loadControl(String controlId) {
        return controlRepository.findById(controlId).map(control -> new ControlView(
                control,
                parameterRepository.findAllByControlIdOrderByParameterIdAsc(controlId),
                partRepository.findAllByControlId(controlId),
                propRepository.findAllByControlId(controlId),
                linkRepository.findAllByControlId(controlId),
                controlRelationRepository.findAllByParentControlIdOrderByChildControlIdAsc(controlId).stream()
                        .map(ControlRelation::getChildControlId)
                        .toList()));
    }

    @Transactional(readOnly = true)
    public List<ControlFamily> listFamilies() {
        return controlFamilyRepository.findAllByOrderByFamilyCodeAsc();
    }

    @Transactional(readOnly = true)
    public List<String> listBaselineControlIds(Integer baselineId) {
        return baselineControlRepository.findAllByBaselineIdOrderByControlIdAsc(baselineId).stream()
                .map(BaselineControl::getControlId)
                .toList();
    }
}
