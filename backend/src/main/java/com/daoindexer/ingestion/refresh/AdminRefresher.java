package com.daoindexer.ingestion.refresh;

import com.daoindexer.domain.Admin;
import com.daoindexer.domain.AdminRepository;
import com.daoindexer.domain.EntityType;
import com.daoindexer.ingestion.parser.ContractDataParser;
import org.springframework.stereotype.Component;

@Component
public class AdminRefresher extends AbstractEntityRefresher<Admin> {

    private final ContractDataParser parser;

    public AdminRefresher(AdminRepository repository, ContractDataParser parser) {
        super(repository);
        this.parser = parser;
    }

    @Override
    public EntityType entityType() {
        return EntityType.ADMIN;
    }

    @Override
    protected Admin copyOf(Admin stored) {
        return new Admin(stored);
    }

    @Override
    protected void parse(Admin copy) {
        parser.updateAdmin(copy);
    }
}
