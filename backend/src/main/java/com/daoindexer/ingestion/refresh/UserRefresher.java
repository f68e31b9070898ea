package com.daoindexer.ingestion.refresh;

import com.daoindexer.domain.EntityType;
import com.daoindexer.domain.User;
import com.daoindexer.domain.UserRepository;
import com.daoindexer.ingestion.parser.ContractDataParser;
import org.springframework.stereotype.Component;

@Component
public class UserRefresher extends AbstractEntityRefresher<User> {

    private final ContractDataParser parser;

    public UserRefresher(UserRepository repository, ContractDataParser parser) {
        super(repository);
        this.parser = parser;
    }

    @Override
    public EntityType entityType() {
        return EntityType.USER;
    }

    @Override
    protected User copyOf(User stored) {
        return new User(stored);
    }

    @Override
    protected void parse(User copy) {
        parser.updateUser(copy);
    }
}
