package com.orderdesk.backend.config;

import com.orderdesk.backend.model.User;
import com.orderdesk.backend.repository.UserRepository;
import com.orderdesk.backend.security.AuthUser;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

@Service
public class UserDetailsServiceImpl implements UserDetailsService {

    @Autowired
    UserRepository userRepository;

    // Login resolves by email
    @Override
    public AuthUser loadUserByUsername(String email) throws UsernameNotFoundException {
        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new UsernameNotFoundException("User Not Found with email: " + email));
        return AuthUser.from(user);
    }

    // Tokens carry the id, so the filter resolves by id
    public AuthUser loadUserById(String id) throws UsernameNotFoundException {
        User user = userRepository.findUnique(id)
                .orElseThrow(() -> new UsernameNotFoundException("User Not Found with id: " + id));
        return AuthUser.from(user);
    }
}
